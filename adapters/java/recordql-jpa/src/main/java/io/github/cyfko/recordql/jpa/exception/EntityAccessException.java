package io.github.cyfko.recordql.jpa.exception;

/**
 * Exception thrown when an entity cannot be read, written or instantiated reflectively.
 *
 * <p>This typically occurs when:</p>
 * <ul>
 *   <li>The entity class has no no-argument constructor</li>
 *   <li>A field cannot be made accessible under the current security or module settings</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class EntityAccessException extends RuntimeException {

    public EntityAccessException(String message) {
        super(message);
    }

    public EntityAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.github.cyfko.recordql.core.api;

import io.github.cyfko.recordql.core.model.FieldDescriptor;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Reference to a field of a record, either a direct field or a path walking through relations.
 * <p>
 * A {@code FieldRef} only names the field. It is resolved against a concrete record by
 * {@link io.github.cyfko.recordql.core.resolve.FieldPathResolver}, which looks the names up in
 * the record's schema. No reflection is involved.
 * </p>
 *
 * <pre>{@code
 * FieldRef name = FieldRef.parse("Name");              // Direct[field=Name]
 * FieldRef parentName = FieldRef.parse("Parent.Name"); // Path[segments=[Parent, Name]]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface FieldRef permits FieldRef.Direct, FieldRef.Path {

    /**
     * Returns the segments of this reference, outermost relation first and terminal field last.
     *
     * @return an immutable, non-empty list of field names
     */
    List<String> segments();

    /**
     * Returns the dotted notation of this reference, e.g. {@code "Parent.Name"}.
     *
     * @return the dotted path
     */
    default String path() {
        return String.join(".", segments());
    }

    /**
     * Parses a field name or a dotted relation path.
     *
     * @param path a field name such as {@code "Name"} or a path such as {@code "Parent.Owner.Name"}
     * @return a {@link Direct} reference for plain names, a {@link Path} otherwise
     * @throws IllegalArgumentException if the path is blank or contains an empty segment
     */
    static FieldRef parse(String path) {
        Objects.requireNonNull(path, "Field path cannot be null");
        if (path.isBlank()) {
            throw new IllegalArgumentException("Field path cannot be blank");
        }

        String[] segments = path.trim().split("\\.", -1);
        for (String segment : segments) {
            if (segment.isBlank()) {
                throw new IllegalArgumentException("Field path contains an empty segment: '" + path + "'");
            }
        }

        if (segments.length == 1) {
            return new Direct(segments[0].trim());
        }
        return new Path(Arrays.stream(segments).map(String::trim).toList());
    }

    /**
     * Creates a direct reference to the field described by {@code descriptor}.
     *
     * @param descriptor the field descriptor
     * @return a direct reference
     */
    static FieldRef of(FieldDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "Field descriptor cannot be null");
        return new Direct(descriptor.name());
    }

    /**
     * A field of the record itself.
     *
     * @param field the field name
     */
    record Direct(String field) implements FieldRef {
        public Direct {
            Objects.requireNonNull(field, "field cannot be null");
        }

        @Override
        public List<String> segments() {
            return List.of(field);
        }

        @Override
        public String toString() {
            return field;
        }
    }

    /**
     * A field reached by walking one or more relations.
     *
     * @param segments relation names followed by the terminal field name
     */
    record Path(List<String> segments) implements FieldRef {
        public Path {
            Objects.requireNonNull(segments, "segments cannot be null");
            if (segments.size() < 2) {
                throw new IllegalArgumentException("A relation path needs at least two segments, got " + segments);
            }
            segments = List.copyOf(segments);
        }

        @Override
        public String toString() {
            return path();
        }
    }
}

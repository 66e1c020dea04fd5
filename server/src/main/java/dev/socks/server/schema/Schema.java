package dev.socks.server.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declarative shape of a request: every listed field must be present and match its rule.
 * Fields are checked in the order they were declared. Unlisted fields are ignored.
 *
 * <pre>
 * Schema schema = Schema.builder()
 *     .field("n", JsonType.INTEGER)
 *     .field("scale", JsonType.INTEGER, JsonType.FLOAT)
 *     .field("options", Schema.builder().field("verbose", JsonType.BOOLEAN).build())
 *     .build();
 * </pre>
 */
public final class Schema {

    private final Map<String, Rule> fields;

    private Schema(Map<String, Rule> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, Rule> fields() {
        return fields;
    }

    /**
     * Constraint on one field.
     */
    public interface Rule {
    }

    /** Value must have exactly this type. */
    public record TypeRule(JsonType type) implements Rule {

        public TypeRule {
            Objects.requireNonNull(type, "type");
        }
    }

    /** Value must have one of these types. */
    public record AnyOfRule(List<JsonType> types) implements Rule {

        public AnyOfRule {
            if (types.isEmpty()) {
                throw new IllegalArgumentException("At least one type is required");
            }
            types = List.copyOf(types);
        }
    }

    /** Value must be an object that satisfies a nested schema. */
    public record NestedRule(Schema schema) implements Rule {

        public NestedRule {
            Objects.requireNonNull(schema, "schema");
        }
    }

    public static final class Builder {

        private final Map<String, Rule> fields = new LinkedHashMap<>();

        public Builder field(String name, JsonType type) {
            return rule(name, new TypeRule(type));
        }

        public Builder field(String name, JsonType first, JsonType... more) {
            if (more.length == 0) {
                return field(name, first);
            }
            JsonType[] all = new JsonType[more.length + 1];
            all[0] = first;
            System.arraycopy(more, 0, all, 1, more.length);
            return rule(name, new AnyOfRule(List.of(all)));
        }

        public Builder field(String name, Schema nested) {
            return rule(name, new NestedRule(nested));
        }

        public Builder rule(String name, Rule rule) {
            fields.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(rule, "rule"));
            return this;
        }

        public Schema build() {
            return new Schema(fields);
        }
    }
}

package io.github.drompincen.polarionclient.runtime.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.polarionclient.runtime.resource.CustomFields;
import io.github.drompincen.polarionclient.runtime.resource.Resource;
import io.github.drompincen.polarionclient.runtime.schema.FieldType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Maps the custom fields of a resource onto a plain Java object through an explicit table of
 * bindings.
 *
 * <pre>{@code
 * CustomFieldBinder<RiskInfo> binder = CustomFieldBinder.<RiskInfo>builder()
 *         .bind("riskLevel", FieldTypes.STRING, RiskInfo::getRiskLevel, RiskInfo::setRiskLevel)
 *         .bind("storyPoints", FieldTypes.INTEGER, RiskInfo::getStoryPoints, RiskInfo::setStoryPoints)
 *         .build();
 * }</pre>
 */
public final class CustomFieldBinder<T> {

    private final List<Binding<T, ?>> bindings;

    private CustomFieldBinder(List<Binding<T, ?>> bindings) {
        this.bindings = List.copyOf(bindings);
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    /**
     * Copies every bound custom field present on the resource into the target. Properties whose
     * field is missing or has a different shape are left untouched.
     */
    public T load(Resource resource, T target, ObjectMapper mapper) {
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(target, "target");
        CustomFields fields = new CustomFields(resource.attributes(), mapper);
        for (Binding<T, ?> binding : bindings) {
            binding.load(fields, target);
        }
        return target;
    }

    /**
     * Writes every bound property into the resource. A null property removes the custom field.
     */
    public void save(T source, Resource resource, ObjectMapper mapper) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(resource, "resource");
        CustomFields fields = new CustomFields(resource.attributes(), mapper);
        for (Binding<T, ?> binding : bindings) {
            binding.save(source, fields);
        }
    }

    public List<String> fieldNames() {
        return bindings.stream().map(Binding::name).toList();
    }

    private record Binding<T, V>(String name, FieldType<V> type,
                                 Function<T, V> getter, BiConsumer<T, V> setter) {

        void load(CustomFields fields, T target) {
            fields.get(name, type).ifPresent(value -> setter.accept(target, value));
        }

        void save(T source, CustomFields fields) {
            fields.set(name, type, getter.apply(source));
        }
    }

    public static final class Builder<T> {
        private final List<Binding<T, ?>> bindings = new ArrayList<>();
        private final Set<String> names = new HashSet<>();

        private Builder() {}

        public <V> Builder<T> bind(String wireName, FieldType<V> type,
                                   Function<T, V> getter, BiConsumer<T, V> setter) {
            Objects.requireNonNull(wireName, "wireName");
            if (!names.add(wireName)) {
                throw new IllegalArgumentException("Custom field '" + wireName + "' is bound twice");
            }
            bindings.add(new Binding<>(wireName, type, getter, setter));
            return this;
        }

        public CustomFieldBinder<T> build() {
            return new CustomFieldBinder<>(bindings);
        }
    }
}

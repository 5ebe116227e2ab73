package io.github.typexform.types;

import java.util.*;

public final class ClassType extends Type {
    private final Map<String, ClassProperty> properties;

    ClassType(TypeGraph graph, int index, Map<String, ClassProperty> properties) {
        super(graph, index, TypeKind.CLASS);
        this.properties = Collections.unmodifiableMap(properties);
    }

    public Map<String, ClassProperty> getProperties() {
        return properties;
    }

    public Type getPropertyType(String name) {
        ClassProperty property = properties.get(name);
        if (property == null) {
            throw new IllegalArgumentException(this + " has no property " + name);
        }
        return graph.typeAt(property.typeRef);
    }

    @Override
    public List<TypeRef> getChildRefs() {
        List<TypeRef> refs = new ArrayList<>();
        for (ClassProperty property : properties.values()) {
            refs.add(property.typeRef);
        }
        return refs;
    }

    @Override
    public TypeRef reconstitute(GraphRewriteBuilder builder, TypeRef forwardingRef) {
        Map<String, ClassProperty> newProperties = new LinkedHashMap<>();
        for (Map.Entry<String, ClassProperty> entry : properties.entrySet()) {
            ClassProperty property = entry.getValue();
            newProperties.put(entry.getKey(), new ClassProperty(
                    builder.reconstituteTypeRef(property.typeRef),
                    property.isOptional
            ));
        }
        return builder.getClassType(
                builder.reconstituteTypeAttributes(getAttributes()),
                newProperties,
                forwardingRef
        );
    }

    @Override
    public String debugDescription() {
        StringBuilder sb = new StringBuilder("class{");
        boolean first = true;
        for (Map.Entry<String, ClassProperty> entry : properties.entrySet()) {
            if (!first) sb.append(", ");
            first = false;
            sb.append(entry.getKey());
            if (entry.getValue().isOptional) sb.append('?');
            sb.append(": ").append(refString(entry.getValue().typeRef));
        }
        return sb.append('}').toString();
    }
}

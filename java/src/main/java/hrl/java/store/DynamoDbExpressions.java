package hrl.java.store;

import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders conditions and update actions as DynamoDB expressions. Every
 * attribute name goes through a placeholder so reserved words never clash.
 */
final class DynamoDbExpressions {

    private final Map<String, String> names = new LinkedHashMap<>();
    private final Map<String, String> placeholders = new HashMap<>();
    private final Map<String, AttributeValue> values = new LinkedHashMap<>();

    String name(String attribute) {
        return placeholders.computeIfAbsent(attribute, a -> {
            String placeholder = "#a" + placeholders.size();
            names.put(placeholder, a);
            return placeholder;
        });
    }

    String value(Object value) {
        String placeholder = ":v" + values.size();
        values.put(placeholder, DynamoDbItemStore.toAttributeValue(value));
        return placeholder;
    }

    String condition(List<Condition> conditions) {
        if (conditions.isEmpty()) return null;
        List<String> clauses = new ArrayList<>();
        for (Condition condition : conditions) {
            clauses.add(clause(condition));
        }
        return String.join(" AND ", clauses);
    }

    private String clause(Condition condition) {
        if (condition instanceof Condition.Equals) {
            Condition.Equals eq = (Condition.Equals) condition;
            return name(eq.attribute()) + " = " + value(eq.value());
        }
        if (condition instanceof Condition.AtLeast) {
            Condition.AtLeast ge = (Condition.AtLeast) condition;
            return name(ge.attribute()) + " >= " + value(ge.value());
        }
        if (condition instanceof Condition.Exists) {
            return "attribute_exists(" + name(condition.attribute()) + ")";
        }
        return "attribute_not_exists(" + name(condition.attribute()) + ")";
    }

    String update(UpdateRequest request) {
        List<String> setParts = new ArrayList<>();
        request.set().forEach((attribute, v) -> setParts.add(name(attribute) + " = " + value(v)));
        request.setIfAbsent().forEach((attribute, v) -> {
            String n = name(attribute);
            setParts.add(n + " = if_not_exists(" + n + ", " + value(v) + ")");
        });
        List<String> addParts = new ArrayList<>();
        request.add().forEach((attribute, delta) -> addParts.add(name(attribute) + " " + value(delta)));
        List<String> removeParts = new ArrayList<>();
        request.remove().forEach(attribute -> removeParts.add(name(attribute)));

        List<String> sections = new ArrayList<>();
        if (!setParts.isEmpty()) sections.add("SET " + String.join(", ", setParts));
        if (!addParts.isEmpty()) sections.add("ADD " + String.join(", ", addParts));
        if (!removeParts.isEmpty()) sections.add("REMOVE " + String.join(", ", removeParts));
        return String.join(" ", sections);
    }

    Map<String, String> names() {
        return names;
    }

    Map<String, AttributeValue> values() {
        return values;
    }
}

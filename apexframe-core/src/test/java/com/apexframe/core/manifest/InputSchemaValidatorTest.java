package com.apexframe.core.manifest;

import com.apexframe.api.exception.ActionInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InputSchemaValidator 输入校验")
class InputSchemaValidatorTest {

    private final ActionDescriptor action = new ActionDescriptor("submit", Map.of(
            "type", "object",
            "required", List.of("name"),
            "additionalProperties", false,
            "properties", Map.of(
                    "name", Map.of("type", "string"),
                    "count", Map.of("type", "integer"),
                    "tags", Map.of("type", "array", "items", Map.of("type", "string")))),
            false, Set.of());

    @Test
    @DisplayName("合法输入通过")
    void acceptsValidInput() {
        assertDoesNotThrow(() -> InputSchemaValidator.validate(action,
                Map.of("name", "n", "count", 3, "tags", List.of("a", "b"))));
    }

    @Test
    @DisplayName("缺失字段、类型错误与多余字段一并报告")
    void reportsProblems() {
        ActionInputException e = assertThrows(ActionInputException.class,
                () -> InputSchemaValidator.validate(action,
                        Map.of("count", "three", "tags", List.of("a", 1), "extra", true)));

        List<String> problems = e.getProblems();
        assertTrue(problems.contains("input.name is required"));
        assertTrue(problems.stream().anyMatch(p -> p.startsWith("input.count must be of type integer")));
        assertTrue(problems.stream().anyMatch(p -> p.startsWith("input.tags[1] must be of type string")));
        assertTrue(problems.contains("input.extra is not an allowed property"));
    }

    @Test
    @DisplayName("未声明 schema 的动作接受任意输入")
    void emptySchemaAcceptsAnything() {
        assertDoesNotThrow(() -> InputSchemaValidator.validate(ActionDescriptor.of("free", false),
                Map.of("anything", List.of(1, 2))));
    }
}

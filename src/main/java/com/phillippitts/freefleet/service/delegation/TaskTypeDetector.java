package com.phillippitts.freefleet.service.delegation;

import com.phillippitts.freefleet.domain.ModelCategory;
import com.phillippitts.freefleet.domain.TaskType;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Keyword classifier mapping a prompt to a {@link TaskType}.
 *
 * <p>Types are tested in declaration order and the first type with a matching pattern wins,
 * so "debug this function" is debugging and "write a function" is code generation.
 * Prompts matching nothing are {@link TaskType#GENERAL}.
 */
@Component
public class TaskTypeDetector {

    private final Map<TaskType, List<Pattern>> patterns = new EnumMap<>(TaskType.class);

    public TaskTypeDetector() {
        patterns.put(TaskType.CODE_GENERATION, compile(
                "write\\s+(a\\s+)?(function|class|code|script|component|module|api)",
                "implement\\s+",
                "create\\s+(a\\s+)?(function|class|component|module|api|script)",
                "generate\\s+(code|function|class)",
                "build\\s+(a|an)\\s+(app|component|feature)"));
        patterns.put(TaskType.CODE_REVIEW, compile(
                "review\\s+(this|the)\\s+code",
                "what('s| is)\\s+wrong\\s+with",
                "improve\\s+(the\\s+)?(code|performance)",
                "check\\s+(this|the)\\s+code",
                "analyze\\s+(this|the)\\s+(code|implementation)"));
        patterns.put(TaskType.DEBUGGING, compile(
                "debug",
                "fix\\s+(this|the)\\s+(error|bug|issue|problem)",
                "why\\s+(is|does)\\s+(this|it|.*function)\\s+(not\\s+work|fail|break|return\\s+null)",
                "error\\s+(in|with)",
                "not\\s+working"));
        patterns.put(TaskType.REASONING, compile(
                "explain\\s+why",
                "reason\\s+through",
                "step\\s+by\\s+step",
                "think\\s+about",
                "analyze\\s+the\\s+(problem|situation)",
                "what\\s+would\\s+happen\\s+if"));
        patterns.put(TaskType.MATH, compile(
                "calculate",
                "solve\\s+(the|this)\\s+(equation|problem)",
                "what\\s+is\\s+\\d+",
                "compute",
                "math(ematical)?"));
        patterns.put(TaskType.WRITING, compile(
                "write\\s+(a|an)\\s+(article|essay|post|blog|story|email)",
                "draft\\s+(a|an)",
                "compose",
                "rewrite",
                "paraphrase"));
        patterns.put(TaskType.SUMMARIZATION, compile(
                "summarize",
                "tldr",
                "give\\s+(me\\s+)?a\\s+summary",
                "brief(ly)?\\s+(explain|describe)",
                "in\\s+a\\s+nutshell"));
        patterns.put(TaskType.TRANSLATION, compile(
                "translate",
                "in\\s+(spanish|french|german|chinese|japanese)",
                "convert\\s+to\\s+(spanish|french|german)"));
        patterns.put(TaskType.MULTIMODAL, compile(
                "image", "picture", "photo", "visual", "diagram", "chart"));
    }

    public TaskType detect(String prompt) {
        if (prompt == null || prompt.isBlank()) {
            return TaskType.GENERAL;
        }
        for (Map.Entry<TaskType, List<Pattern>> entry : patterns.entrySet()) {
            for (Pattern pattern : entry.getValue()) {
                if (pattern.matcher(prompt).find()) {
                    return entry.getKey();
                }
            }
        }
        return TaskType.GENERAL;
    }

    public ModelCategory taskTypeToCategory(TaskType taskType) {
        return taskType.category();
    }

    public Map<TaskType, List<Pattern>> allPatterns() {
        return Collections.unmodifiableMap(patterns);
    }

    private static List<Pattern> compile(String... regexes) {
        return Stream.of(regexes)
                .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE))
                .toList();
    }
}

package com.gantry.executor;

import com.gantry.core.model.Task;
import com.gantry.core.security.RoleCapabilities;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Default renderer producing a Markdown brief. Pure function of its inputs.
 */
@Component
public class MarkdownInstructionRenderer implements InstructionRenderer {

    @Override
    public String render(Task task, RoleCapabilities capabilities, int attempt) {
        var sb = new StringBuilder();

        sb.append("# Task: ").append(task.id()).append("\n\n");

        sb.append("## Goal\n\n");
        sb.append(task.goal()).append("\n\n");

        sb.append("## Role\n\n");
        sb.append("- **Role:** ").append(capabilities.role()).append("\n");
        if (!capabilities.allowedTools().isEmpty()) {
            sb.append("- **Allowed tools:** ").append(String.join(", ", capabilities.allowedTools())).append("\n");
        }
        if (!capabilities.deniedTools().isEmpty()) {
            sb.append("- **Denied tools:** ").append(String.join(", ", capabilities.deniedTools())).append("\n");
        }
        sb.append("- **Network:** ").append(capabilities.networkAllowed() ? "allowed" : "not allowed").append("\n\n");

        sb.append("## Scope\n\n");
        appendList(sb, "You may modify", task.scope().allowedPaths());
        appendList(sb, "You must NOT modify", task.scope().forbiddenPaths());

        if (!task.skills().isEmpty()) {
            sb.append("## Skills\n\n");
            for (String skill : task.skills()) {
                sb.append("- ").append(skill).append("\n");
            }
            sb.append("\n");
        }

        if (attempt > 1 && !task.reasons().isEmpty()) {
            sb.append("## Previous Attempt\n\n");
            sb.append("Attempt ").append(attempt - 1).append(" was rejected for: ")
                    .append(String.join(", ", task.reasons())).append("\n\n");
        }

        sb.append("## Constraints\n\n");
        sb.append("- Only touch files inside the allowed scope; any other change fails the task\n");
        if (capabilities.testsRequired()) {
            sb.append("- Run the relevant tests and report each command and its outcome\n");
        }
        sb.append("- If the goal is ambiguous, stop and submit NEED_INPUT instead of guessing\n\n");

        sb.append("## Submission\n\n");
        sb.append("When finished, write JSON to the file named by `$GANTRY_SUBMISSION_FILE`:\n\n");
        sb.append("```json\n");
        sb.append("{\"task_id\": \"").append(task.id()).append("\", \"status\": \"DONE|NEED_INPUT|FAILED\", ");
        sb.append("\"exit_code\": 0, \"touched_files\": [], \"tools_used\": [], ");
        sb.append("\"tests\": [{\"command\": \"...\", \"passed\": true}], \"evidence\": {}}\n");
        sb.append("```\n");

        return sb.toString();
    }

    private static void appendList(StringBuilder sb, String heading, List<String> patterns) {
        sb.append("**").append(heading).append(":**\n");
        if (patterns.isEmpty()) {
            sb.append("- (none)\n");
        }
        for (String pattern : patterns) {
            sb.append("- `").append(pattern).append("`\n");
        }
        sb.append("\n");
    }
}

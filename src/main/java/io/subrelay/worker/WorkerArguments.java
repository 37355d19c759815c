package io.subrelay.worker;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command lines for the worker CLI. Streaming runs ask for JSON events on stdout; blocking runs
 * print only the final answer.
 */
public final class WorkerArguments {
    private WorkerArguments() {
    }

    public static List<String> streaming(
            List<String> workerCommand,
            String model,
            List<String> tools,
            Path systemPromptPath,
            String task
    ) {
        List<String> args = new ArrayList<>(workerCommand);
        args.add("--mode");
        args.add("json");
        appendCommon(args, model, tools, systemPromptPath, task);
        return args;
    }

    public static List<String> blocking(
            List<String> workerCommand,
            String model,
            List<String> tools,
            Path systemPromptPath,
            String task
    ) {
        List<String> args = new ArrayList<>(workerCommand);
        appendCommon(args, model, tools, systemPromptPath, task);
        return args;
    }

    private static void appendCommon(
            List<String> args,
            String model,
            List<String> tools,
            Path systemPromptPath,
            String task
    ) {
        args.add("-p");
        args.add("--no-session");
        if (model != null && !model.isBlank()) {
            args.add("--model");
            args.add(model);
        }
        if (tools != null && !tools.isEmpty()) {
            args.add("--tools");
            args.add(String.join(",", tools));
        }
        if (systemPromptPath != null) {
            args.add("--append-system-prompt");
            args.add(systemPromptPath.toString());
        }
        args.add("Task: " + (task == null ? "" : task));
    }
}

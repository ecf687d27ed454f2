package com.optmodeler.cli;

import com.optmodeler.core.expression.MathFunction;
import com.optmodeler.core.generator.CodeGenerator;
import com.optmodeler.core.renderer.OutputRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.Locale;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to list available generators, renderers or built-in functions.
 *
 * <p>Generators and renderers are discovered via the Java Service Provider Interface.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * optmodeler list generators
 * optmodeler list renderers
 * optmodeler list functions
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available generators, renderers or functions",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: generators, renderers or functions"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "generators", "generator" -> listGenerators();
            case "renderers", "renderer" -> listRenderers();
            case "functions", "function" -> listFunctions();
            default -> {
                log.error("Unknown type: {}. Use: generators, renderers or functions", type);
                yield 1;
            }
        };
    }

    private int listGenerators() {
        System.out.println("Available Generators:");
        System.out.println();

        boolean found = false;
        for (CodeGenerator generator : ServiceLoader.load(CodeGenerator.class)) {
            found = true;
            System.out.printf("  • %s (ID: %s)%n", generator.getDisplayName(), generator.getId());
            System.out.printf("    File Extension: .%s%n", generator.getFileExtension());
            System.out.println();
        }

        if (!found) {
            System.out.println("  No generators found.");
        }
        return 0;
    }

    private int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();

        boolean found = false;
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            found = true;
            System.out.printf("  • %s%n", renderer.getId());
        }

        if (!found) {
            System.out.println("  No renderers found.");
        }
        return 0;
    }

    private int listFunctions() {
        System.out.println("Built-in Functions:");
        System.out.println();
        for (MathFunction function : MathFunction.values()) {
            System.out.printf("  • %s%n", function.solverName());
        }
        return 0;
    }
}

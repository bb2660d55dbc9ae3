package work.lcod.pointfree.cli;

import java.util.Arrays;
import java.util.stream.Collectors;
import picocli.CommandLine;
import work.lcod.pointfree.compiler.Primitive;

/**
 * Reports the jar version and the operator vocabulary the output targets.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        String version = implementationVersion != null ? implementationVersion : "development";
        String primitives = Arrays.stream(Primitive.values()).map(Primitive::wireName).collect(Collectors.joining(", "));
        return new String[] {
            "pointfree-compile (java) " + version,
            "primitives: " + primitives
        };
    }
}

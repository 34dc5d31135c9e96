package ai.docsite.plaintext.math;

import java.util.List;

@FunctionalInterface
interface MacroHandler {

    String apply(List<MacroArgument> arguments);
}

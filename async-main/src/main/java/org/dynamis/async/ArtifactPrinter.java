package org.dynamis.async;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.printer.DefaultPrettyPrinter;
import com.github.javaparser.printer.configuration.DefaultPrinterConfiguration;
import org.dynamis.async.model.StateMachineArtifact;

/**
 * Renders lowered code as Java source.
 */
public final class ArtifactPrinter {

    private ArtifactPrinter() {}

    public static String print(Node node) {
        return new DefaultPrettyPrinter(new DefaultPrinterConfiguration()).print(node);
    }

    /**
     * The members of one state machine in the order they are added to the owning class:
     * fields, entry, dispatcher.
     */
    public static String print(StateMachineArtifact artifact) {
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter(new DefaultPrinterConfiguration());
        StringBuilder sb = new StringBuilder();
        for (FieldDeclaration field : artifact.fields()) {
            sb.append(printer.print(field)).append(System.lineSeparator());
        }
        sb.append(System.lineSeparator());
        sb.append(printer.print(artifact.entry())).append(System.lineSeparator());
        sb.append(System.lineSeparator());
        sb.append(printer.print(artifact.dispatch())).append(System.lineSeparator());
        return sb.toString();
    }
}

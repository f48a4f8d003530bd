package org.dynamis.async.test;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import org.dynamis.async.bind.AsyncParsers;

/**
 * Source skeletons for behaviours under test.
 */
public final class Fixtures {

    public static final String PACKAGE = "fixtures";

    private Fixtures() {}

    /**
     * A public behaviour {@code fixtures.<name>} with an {@code events} list, a {@code log} helper and
     * the given members.
     */
    public static String behaviour(String name, String members) {
        return "package " + PACKAGE + ";\n"
                + "\n"
                + "import java.util.ArrayList;\n"
                + "import java.util.List;\n"
                + "import org.dynamis.async.runtime.AsyncBehaviour;\n"
                + "import org.dynamis.async.runtime.AsyncProcedure;\n"
                + "import org.dynamis.async.runtime.CancellationToken;\n"
                + "import org.dynamis.async.runtime.Task;\n"
                + "\n"
                + "import static org.dynamis.async.runtime.Async.await;\n"
                + "\n"
                + "public class " + name + " extends AsyncBehaviour {\n"
                + "\n"
                + "    public final List<String> events = new ArrayList<>();\n"
                + "\n"
                + "    void log(String message) {\n"
                + "        events.add(message);\n"
                + "    }\n"
                + "\n"
                + members
                + "}\n";
    }

    public static String qualified(String name) {
        return PACKAGE + "." + name;
    }

    public static CompilationUnit parse(String source) {
        return AsyncParsers.newParser().parse(source).getResult()
                .orElseThrow(() -> new AssertionError("Unparsable fixture:\n" + source));
    }

    public static MethodDeclaration method(CompilationUnit unit, String name) {
        return unit.findFirst(MethodDeclaration.class, m -> m.getNameAsString().equals(name))
                .orElseThrow(() -> new AssertionError("No method " + name));
    }

    public static ClassOrInterfaceDeclaration owner(MethodDeclaration method) {
        return method.findAncestor(ClassOrInterfaceDeclaration.class)
                .orElseThrow(() -> new AssertionError("Method outside a class"));
    }
}

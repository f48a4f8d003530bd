package org.dynamis.async.bind;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.symbolsolver.JavaSymbolSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.ClassLoaderTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.CombinedTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.ReflectionTypeSolver;

/**
 * Parser and symbol solver configuration shared by the lowering and its callers.
 */
public final class AsyncParsers {

    private AsyncParsers() {}

    public static JavaSymbolSolver newSymbolSolver(ClassLoader classLoader) {
        CombinedTypeSolver typeSolver = new CombinedTypeSolver(
                new ReflectionTypeSolver(),
                new ClassLoaderTypeSolver(classLoader));
        return new JavaSymbolSolver(typeSolver);
    }

    public static ParserConfiguration newConfiguration(ClassLoader classLoader) {
        return new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setSymbolResolver(newSymbolSolver(classLoader));
    }

    public static JavaParser newParser(ClassLoader classLoader) {
        return new JavaParser(newConfiguration(classLoader));
    }

    public static JavaParser newParser() {
        return newParser(AsyncParsers.class.getClassLoader());
    }
}

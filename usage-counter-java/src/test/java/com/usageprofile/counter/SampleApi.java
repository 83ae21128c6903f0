package com.usageprofile.counter;

import com.usageprofile.counter.api.ApiDescription;
import com.usageprofile.counter.api.ApiElement;
import com.usageprofile.counter.api.ApiParameter;
import com.usageprofile.counter.corpus.SourceFile;
import com.usageprofile.counter.static_analysis.CallResolver;
import com.usageprofile.counter.static_analysis.CallSite;
import com.usageprofile.counter.static_analysis.ParseResult;
import com.usageprofile.counter.static_analysis.PythonSourceParser;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

/**
 * Small in-memory API description shared by the resolver and binder tests:
 *
 * <pre>
 * pkg.fn(a, x=None, y=5)
 * pkg.other(a, /, b, *args, flag=False, **kwargs)
 * pkg.sub.helper(value)
 * pkg.sub._impl.Model(alpha=1.0)       re-exported as pkg.sub.Model and pkg.Model
 * pkg.sub._impl.Model.fit(X, y=None)
 * pkg.Bare                              class without constructor entry
 * pkg.alt.helper(value)                 second element named "helper"
 * </pre>
 */
final class SampleApi {

    static final Path FIXTURE_ROOT =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/sklearn-clients");

    private SampleApi() {}

    static ApiParameter p(String name) {
        return new ApiParameter(name, ApiParameter.Kind.POSITIONAL_OR_KEYWORD, null);
    }

    static ApiParameter p(String name, String defaultValue) {
        return new ApiParameter(name, ApiParameter.Kind.POSITIONAL_OR_KEYWORD, defaultValue);
    }

    static ApiParameter p(String name, ApiParameter.Kind kind, String defaultValue) {
        return new ApiParameter(name, kind, defaultValue);
    }

    static ApiElement function(String qname, ApiParameter... parameters) {
        return new ApiElement(qname, ApiElement.Kind.FUNCTION, List.of(parameters));
    }

    static ApiDescription api() {
        return new ApiDescription("pkg", List.of(
                new ApiElement("pkg", ApiElement.Kind.MODULE, List.of()),
                new ApiElement("pkg.sub", ApiElement.Kind.MODULE, List.of()),
                function("pkg.fn", p("a"), p("x", "None"), p("y", "5")),
                function("pkg.other",
                        p("a", ApiParameter.Kind.POSITIONAL_ONLY, null),
                        p("b"),
                        p("args", ApiParameter.Kind.VAR_POSITIONAL, null),
                        p("flag", ApiParameter.Kind.KEYWORD_ONLY, "False"),
                        p("kwargs", ApiParameter.Kind.VAR_KEYWORD, null)),
                function("pkg.sub.helper", p("value")),
                new ApiElement("pkg.sub._impl.Model", ApiElement.Kind.CLASS, List.of()),
                new ApiElement("pkg.sub._impl.Model.__init__", ApiElement.Kind.METHOD, List.of(p("alpha", "1.0"))),
                new ApiElement("pkg.sub._impl.Model.fit", ApiElement.Kind.METHOD, List.of(p("X"), p("y", "None"))),
                new ApiElement("pkg.Bare", ApiElement.Kind.CLASS, List.of()),
                function("pkg.alt.helper", p("value"))
        ), Map.of(
                "pkg.sub.Model", "pkg.sub._impl.Model",
                "pkg.Model", "pkg.sub.Model"
        ));
    }

    /** Call sites of {@code code} as if it were the file {@code relativePath}. */
    static List<CallSite> callSites(String relativePath, String code, boolean inferInstances) {
        ParseResult result = new PythonSourceParser(0, false).parse(SourceFile.of(relativePath, code));
        if (result instanceof ParseResult.Failed failed) {
            throw new AssertionError("Fixture code does not parse: " + failed);
        }
        return new CallResolver(api(), inferInstances).resolve(((ParseResult.Parsed) result).source());
    }

    static List<CallSite> callSites(String code) {
        return callSites("client/app.py", code, false);
    }
}

package com.usageprofile.counter;

import com.usageprofile.counter.static_analysis.CallSite;
import com.usageprofile.counter.static_analysis.CallTarget;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CallResolverTest {

    private static CallTarget single(List<CallSite> sites) {
        assertEquals(1, sites.size(), "Expected exactly one call site: " + sites);
        return sites.get(0).target();
    }

    private static CallTarget resolved(String element) {
        return new CallTarget.Resolved(element);
    }

    private static CallTarget unresolved(CallTarget.Reason reason) {
        return new CallTarget.Unresolved(reason);
    }

    @Test
    void aliasedModuleImport() {
        assertEquals(resolved("pkg.fn"), single(SampleApi.callSites("""
            import pkg as p
            p.fn(1, x=2)
            """)));
    }

    @Test
    void plainImportBindsTopLevelName() {
        assertEquals(resolved("pkg.sub.helper"), single(SampleApi.callSites("""
            import pkg.sub
            pkg.sub.helper(1)
            """)));
    }

    @Test
    void aliasedSubmoduleImport() {
        assertEquals(resolved("pkg.sub.helper"), single(SampleApi.callSites("""
            import pkg.sub as s
            s.helper(1)
            """)));
    }

    @Test
    void fromImportWithAlias() {
        assertEquals(resolved("pkg.sub.helper"), single(SampleApi.callSites("""
            from pkg.sub import helper as h
            h(1)
            """)));
    }

    @Test
    void futureImportsAreIgnored() {
        assertEquals(resolved("pkg.fn"), single(SampleApi.callSites("""
            from __future__ import annotations
            from pkg import fn
            fn(1)
            """)));
    }

    @Test
    void reExportedClassResolvesToCanonicalConstructor() {
        assertEquals(resolved("pkg.sub._impl.Model.__init__"), single(SampleApi.callSites("""
            from pkg import Model
            Model(alpha=0.5)
            """)));
    }

    @Test
    void classWithoutConstructorEntryIsUnresolved() {
        assertEquals(unresolved(CallTarget.Reason.NO_CONSTRUCTOR), single(SampleApi.callSites("""
            import pkg
            pkg.Bare()
            """)));
    }

    @Test
    void unknownMemberIsNotInApi() {
        assertEquals(unresolved(CallTarget.Reason.NOT_IN_API), single(SampleApi.callSites("""
            import pkg
            pkg.missing(1)
            """)));
    }

    @Test
    void builtinIsUnbound() {
        assertEquals(unresolved(CallTarget.Reason.UNBOUND_NAME), single(SampleApi.callSites("print(1)\n")));
    }

    @Test
    void callOnCallResultIsDynamic() {
        List<CallSite> sites = SampleApi.callSites("""
            import pkg
            pkg.fn(1).strip()
            """);
        assertEquals(2, sites.size());
        assertEquals(unresolved(CallTarget.Reason.DYNAMIC_CALLEE), sites.get(0).target());
        assertEquals(resolved("pkg.fn"), sites.get(1).target());
    }

    @Test
    void nestedCallsEachProduceACallSite() {
        List<CallSite> sites = SampleApi.callSites("""
            import pkg
            pkg.fn(pkg.sub.helper(pkg.fn(2)))
            """);
        assertEquals(3, sites.size());
        assertEquals(2, sites.stream().filter(s -> s.target().equals(resolved("pkg.fn"))).count());
    }

    @Test
    void rebindingToNonImportShadowsName() {
        assertEquals(unresolved(CallTarget.Reason.SHADOWED_NAME), single(SampleApi.callSites("""
            from pkg import fn
            fn = 42
            fn(1)
            """)));
    }

    @Test
    void functionDefinitionShadowsImport() {
        List<CallSite> sites = SampleApi.callSites("""
            from pkg import fn
            def fn(a):
                return a
            fn(1)
            """);
        assertEquals(unresolved(CallTarget.Reason.SHADOWED_NAME), single(sites));
    }

    @Test
    void referenceAssignmentPropagatesOrigin() {
        assertEquals(resolved("pkg.sub.helper"), single(SampleApi.callSites("""
            import pkg
            h = pkg.sub.helper
            h(1)
            """)));
    }

    @Test
    void lastWriteWins() {
        assertEquals(resolved("pkg.fn"), single(SampleApi.callSites("""
            f = 1
            from pkg import fn as f
            f(1)
            """)));
    }

    @Test
    void conditionalImportsOfDifferentOriginsAreAmbiguous() {
        assertEquals(unresolved(CallTarget.Reason.AMBIGUOUS_BINDING), single(SampleApi.callSites("""
            import sys
            if sys.platform == "win32":
                from pkg import fn as f
            else:
                from pkg.sub import helper as f
            f(1)
            """)));
    }

    @Test
    void importFallbackToNoneIsAmbiguous() {
        assertEquals(unresolved(CallTarget.Reason.AMBIGUOUS_BINDING), single(SampleApi.callSites("""
            try:
                from pkg import fn
            except ImportError:
                fn = None
            fn(1)
            """)));
    }

    @Test
    void conditionalRebindOfModuleAliasIsAmbiguous() {
        List<CallSite> sites = SampleApi.callSites("""
            import pkg as p
            if flag:
                p = make()
            p.fn(1)
            """);
        assertEquals(unresolved(CallTarget.Reason.AMBIGUOUS_BINDING), sites.get(sites.size() - 1).target());
    }

    @Test
    void importOnOnePathOnlyKeepsTheOrigin() {
        assertEquals(resolved("pkg.fn"), single(SampleApi.callSites("""
            if flag:
                from pkg import fn
            fn(1)
            """)));
    }

    @Test
    void reRaisingHandlerKeepsTheOrigin() {
        assertEquals(resolved("pkg.fn"), single(SampleApi.callSites("""
            try:
                from pkg import fn
            except ImportError:
                raise
            fn(1)
            """)));
    }

    @Test
    void tryImportWithAlternativeModuleIsAmbiguous() {
        assertEquals(unresolved(CallTarget.Reason.AMBIGUOUS_BINDING), single(SampleApi.callSites("""
            try:
                from pkg.sub import helper
            except ImportError:
                from pkg.alt import helper
            helper(1)
            """)));
    }

    @Test
    void functionParameterShadowsModuleName() {
        assertEquals(unresolved(CallTarget.Reason.SHADOWED_NAME), single(SampleApi.callSites("""
            import pkg
            def run(pkg):
                pkg.fn(1)
            """)));
    }

    @Test
    void functionBodySeesModuleImports() {
        assertEquals(resolved("pkg.fn"), single(SampleApi.callSites("""
            import pkg
            def run():
                return pkg.fn(1)
            """)));
    }

    @Test
    void localRebindingDoesNotLeakOutOfFunction() {
        List<CallSite> sites = SampleApi.callSites("""
            from pkg import fn
            def run():
                fn = print
                fn(1)
            fn(2)
            """);
        assertEquals(2, sites.size());
        assertEquals(unresolved(CallTarget.Reason.SHADOWED_NAME), sites.get(0).target());
        assertEquals(resolved("pkg.fn"), sites.get(1).target());
    }

    @Test
    void classScopeIsInvisibleToMethods() {
        assertEquals(resolved("pkg.fn"), single(SampleApi.callSites("""
            from pkg import fn
            class Client:
                fn = None
                def go(self):
                    return fn(1)
            """)));
    }

    @Test
    void globalDeclarationRebindsModuleName() {
        List<CallSite> sites = SampleApi.callSites("""
            from pkg import fn
            def reset():
                global fn
                fn = None
            reset()
            fn(1)
            """);
        assertEquals(unresolved(CallTarget.Reason.SHADOWED_NAME), sites.get(sites.size() - 1).target());
    }

    @Test
    void forLoopTargetShadowsInsideBody() {
        List<CallSite> sites = SampleApi.callSites("""
            from pkg import fn
            for fn in range(3):
                fn(1)
            """);
        assertEquals(unresolved(CallTarget.Reason.SHADOWED_NAME), sites.get(1).target());
    }

    @Test
    void loopThatMayNotRunMakesTheImportAmbiguous() {
        List<CallSite> sites = SampleApi.callSites("""
            from pkg import fn
            for fn in range(3):
                pass
            fn(1)
            """);
        assertEquals(unresolved(CallTarget.Reason.AMBIGUOUS_BINDING), sites.get(1).target());
    }

    @Test
    void withAliasShadowsName() {
        List<CallSite> sites = SampleApi.callSites("""
            from pkg import fn
            with open("f") as fn:
                fn(1)
            """);
        assertEquals(unresolved(CallTarget.Reason.SHADOWED_NAME), sites.get(sites.size() - 1).target());
    }

    @Test
    void wildcardImportResolvesModuleMembers() {
        assertEquals(resolved("pkg.sub.helper"), single(SampleApi.callSites("""
            from pkg.sub import *
            helper(1)
            """)));
    }

    @Test
    void wildcardOfUnknownModuleWithUniqueNameResolves() {
        assertEquals(resolved("pkg.fn"), single(SampleApi.callSites("""
            from elsewhere import *
            fn(1)
            """)));
    }

    @Test
    void wildcardWithSeveralCandidatesIsAmbiguous() {
        assertEquals(unresolved(CallTarget.Reason.AMBIGUOUS_WILDCARD), single(SampleApi.callSites("""
            from elsewhere import *
            helper(1)
            """)));
    }

    @Test
    void relativeImportResolvesAgainstFilePackage() {
        List<CallSite> sites = SampleApi.callSites("pkg/sub/client.py", """
            from . import helper
            from .. import fn
            helper(1)
            fn(2)
            """, false);
        assertEquals(resolved("pkg.sub.helper"), sites.get(0).target());
        assertEquals(resolved("pkg.fn"), sites.get(1).target());
    }

    @Test
    void relativeImportAboveRootShadows() {
        assertEquals(unresolved(CallTarget.Reason.SHADOWED_NAME), single(SampleApi.callSites("top.py", """
            from .. import fn
            fn(1)
            """, false)));
    }

    @Test
    void instanceMethodsResolveOnlyWithInstanceInference() {
        String code = """
            from pkg.sub import Model
            m = Model()
            m.fit([1], [2])
            """;
        List<CallSite> plain = SampleApi.callSites("client/app.py", code, false);
        assertEquals(unresolved(CallTarget.Reason.SHADOWED_NAME), plain.get(1).target());

        List<CallSite> inferred = SampleApi.callSites("client/app.py", code, true);
        assertEquals(resolved("pkg.sub._impl.Model.fit"), inferred.get(1).target());
    }

    @Test
    void callSitePositionIsOneBased() {
        CallSite site = SampleApi.callSites("""
            import pkg

            x = [pkg.fn(1)]
            """).get(0);
        assertEquals(3, site.line());
        assertEquals(6, site.column());
    }

    @Test
    void callsInsideLambdasAndComprehensionsAreFound() {
        List<CallSite> sites = SampleApi.callSites("""
            import pkg
            f = lambda v: pkg.fn(v)
            values = [pkg.sub.helper(i) for i in range(3)]
            """);
        assertTrue(sites.stream().anyMatch(s -> s.target().equals(resolved("pkg.fn"))));
        assertTrue(sites.stream().anyMatch(s -> s.target().equals(resolved("pkg.sub.helper"))));
    }
}

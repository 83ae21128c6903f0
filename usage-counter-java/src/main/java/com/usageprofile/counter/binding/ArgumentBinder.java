package com.usageprofile.counter.binding;

import com.usageprofile.counter.aggregate.ValueSignature;
import com.usageprofile.counter.api.ApiElement;
import com.usageprofile.counter.api.ApiParameter;
import com.usageprofile.counter.static_analysis.CallArgument;

import java.util.*;

/**
 * Maps the arguments of a call site onto the formal parameters of the called element.
 *
 * Keyword arguments bind first, by name. Positional arguments then fill the
 * positional-capable formals from left to right, skipping formals already bound by name.
 * Arguments without a formal of their own land in variadic buckets:
 * {@code *args[i]} for the i-th extra positional argument and {@code **kwargs.name} for
 * an unknown keyword, named after the declared catch-all. Without a catch-all they are
 * dropped. Formals left unbound record {@code default} if they declare one and
 * {@code unknown} otherwise.
 *
 * A call-site {@code *xs} makes every positional formal still unbound after it
 * {@code unknown}; a call-site {@code **kw} does the same for every unbound non-variadic
 * formal.
 */
public class ArgumentBinder {

    /**
     * @return parameter or bucket name to value signature, formals in declaration order
     *         followed by variadic buckets
     */
    public Map<String, ValueSignature> bind(ApiElement callee, List<CallArgument> arguments) {
        List<ApiParameter> formals = callee.parameters();
        ApiParameter varPositional = null;
        ApiParameter varKeyword = null;
        List<ApiParameter> positional = new ArrayList<>();
        for (ApiParameter p : formals) {
            if (p.kind() == ApiParameter.Kind.VAR_POSITIONAL && varPositional == null) varPositional = p;
            else if (p.kind() == ApiParameter.Kind.VAR_KEYWORD && varKeyword == null) varKeyword = p;
            else if (p.acceptsPositional()) positional.add(p);
        }

        Map<String, ValueSignature> bound = new HashMap<>();
        Map<String, ValueSignature> buckets = new LinkedHashMap<>();

        for (CallArgument arg : arguments) {
            if (arg.kind() != CallArgument.Kind.KEYWORD) continue;
            ApiParameter formal = callee.parameter(arg.keyword());
            if (formal != null && formal.acceptsKeyword()) {
                bound.putIfAbsent(formal.name(), arg.value());
            } else if (varKeyword != null) {
                buckets.putIfAbsent("**" + varKeyword.name() + "." + arg.keyword(), arg.value());
            }
        }

        boolean listSplat = false;
        boolean dictSplat = false;
        int next = 0;
        int extra = 0;
        for (CallArgument arg : arguments) {
            switch (arg.kind()) {
                case LIST_SPLAT:
                    listSplat = true;
                    break;
                case DICT_SPLAT:
                    dictSplat = true;
                    break;
                case POSITIONAL:
                    // After *xs the position of later arguments is unknown
                    if (listSplat) break;
                    while (next < positional.size() && bound.containsKey(positional.get(next).name())) {
                        next++;
                    }
                    if (next < positional.size()) {
                        bound.put(positional.get(next).name(), arg.value());
                        next++;
                    } else if (varPositional != null) {
                        buckets.put("*" + varPositional.name() + "[" + extra + "]", arg.value());
                        extra++;
                    }
                    break;
                default:
                    break;
            }
        }

        if (listSplat) {
            for (ApiParameter p : positional) {
                bound.putIfAbsent(p.name(), ValueSignature.UNKNOWN);
            }
        }
        Map<String, ValueSignature> result = new LinkedHashMap<>();
        for (ApiParameter p : formals) {
            if (p.isVariadic()) continue;
            ValueSignature value = bound.get(p.name());
            if (value == null) {
                if (dictSplat) value = ValueSignature.UNKNOWN;
                else value = p.hasDefault() ? ValueSignature.USES_DEFAULT : ValueSignature.UNKNOWN;
            }
            result.put(p.name(), value);
        }
        result.putAll(buckets);
        return result;
    }
}

package com.usageprofile.counter.api;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import com.usageprofile.counter.config.ConfigException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Reads the API description produced by the public-API extraction step.
 *
 * Accepts the plain {@code get_public_api} layout (functions with
 * {@code qname}/{@code parameters[name, default_value]} and a flat class list)
 * and the extended layout with explicit element and parameter kinds and a
 * re-export table.
 */
public class ApiDescriptionReader {

    private static final Gson GSON = new Gson();

    public ApiDescription read(Path apiFile) {
        if (!Files.isRegularFile(apiFile)) {
            throw new ConfigException("API description not found: " + apiFile);
        }
        ApiDocument doc;
        try (Reader reader = Files.newBufferedReader(apiFile, StandardCharsets.UTF_8)) {
            doc = GSON.fromJson(reader, ApiDocument.class);
        } catch (IOException e) {
            throw new ConfigException("Failed to read API description: " + apiFile + ": " + e.getMessage(), e);
        } catch (JsonParseException e) {
            throw new ConfigException("API description is not valid JSON: " + apiFile + ": " + e.getMessage(), e);
        }
        if (doc == null) {
            throw new ConfigException("API description is empty: " + apiFile);
        }
        try {
            return toDescription(doc);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid API description " + apiFile + ": " + e.getMessage(), e);
        }
    }

    ApiDescription toDescription(ApiDocument doc) {
        List<ApiElement> elements = new ArrayList<>();
        Set<String> classNames = new HashSet<>();

        for (String module : nonNull(doc.modules)) {
            elements.add(new ApiElement(module, ApiElement.Kind.MODULE, List.of()));
        }
        for (String cls : nonNull(doc.classes)) {
            classNames.add(cls);
            elements.add(new ApiElement(cls, ApiElement.Kind.CLASS, List.of()));
        }
        for (FunctionDoc fn : nonNull(doc.functions)) {
            if (fn.qname == null || fn.qname.isBlank()) {
                throw new IllegalArgumentException("function entry without qname");
            }
            ApiElement.Kind kind = elementKind(fn, classNames);
            elements.add(new ApiElement(fn.qname, kind, parameters(fn, kind)));
        }
        return new ApiDescription(doc.packageName, elements, doc.reexports);
    }

    private static ApiElement.Kind elementKind(FunctionDoc fn, Set<String> classNames) {
        if (fn.kind != null) {
            return switch (fn.kind) {
                case "function" -> ApiElement.Kind.FUNCTION;
                case "method" -> ApiElement.Kind.METHOD;
                default -> throw new IllegalArgumentException("unsupported callable kind '" + fn.kind + "' for " + fn.qname);
            };
        }
        int dot = fn.qname.lastIndexOf('.');
        String parent = dot >= 0 ? fn.qname.substring(0, dot) : "";
        return classNames.contains(parent) ? ApiElement.Kind.METHOD : ApiElement.Kind.FUNCTION;
    }

    private static List<ApiParameter> parameters(FunctionDoc fn, ApiElement.Kind kind) {
        List<ApiParameter> result = new ArrayList<>();
        for (ParameterDoc p : nonNull(fn.parameters)) {
            if (p.name == null) {
                throw new IllegalArgumentException("parameter without name in " + fn.qname);
            }
            result.add(new ApiParameter(p.name, ApiParameter.Kind.fromJson(p.kind), p.defaultValue));
        }
        // Receivers are implicit at every call site the resolver can see
        if (kind == ApiElement.Kind.METHOD && !result.isEmpty()) {
            String first = result.get(0).name();
            if (first.equals("self") || first.equals("cls")) {
                result.remove(0);
            }
        }
        return result;
    }

    private static <T> List<T> nonNull(List<T> list) {
        return list != null ? list : Collections.emptyList();
    }

    static class ApiDocument {
        @SerializedName("distribution") String distribution;
        @SerializedName("package")      String packageName;
        @SerializedName("version")      String version;
        @SerializedName("modules")      List<String> modules;
        @SerializedName("classes")      List<String> classes;
        @SerializedName("functions")    List<FunctionDoc> functions;
        @SerializedName("reexports")    Map<String, String> reexports;
    }

    static class FunctionDoc {
        @SerializedName("qname")      String qname;
        @SerializedName("kind")       String kind;
        @SerializedName("parameters") List<ParameterDoc> parameters;
    }

    static class ParameterDoc {
        @SerializedName("name")          String name;
        @SerializedName("kind")          String kind;
        @SerializedName("default_value") String defaultValue;
    }
}

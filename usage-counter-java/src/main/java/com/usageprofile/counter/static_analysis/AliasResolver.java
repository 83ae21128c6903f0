package com.usageprofile.counter.static_analysis;

import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.usageprofile.counter.static_analysis.PythonNodeTypes.*;

/**
 * Applies import statements and reference assignments of one file to its {@link AliasTable}.
 */
public class AliasResolver {

    private final AliasTable table;
    private final ParsedSource src;

    public AliasResolver(AliasTable table, ParsedSource src) {
        this.table = table;
        this.src = src;
    }

    /**
     * {@code import a.b.c} binds {@code a}; {@code import a.b as x} binds {@code x} to {@code a.b}.
     */
    public void applyImport(TSNode statement) {
        for (int i = 0; i < statement.getNamedChildCount(); i++) {
            TSNode child = statement.getNamedChild(i);
            if (DOTTED_NAME.equals(child.getType())) {
                String dotted = dotted(child);
                String head = dotted.contains(".") ? dotted.substring(0, dotted.indexOf('.')) : dotted;
                table.bind(head, new Binding.Origin(head));
            } else if (ALIASED_IMPORT.equals(child.getType())) {
                TSNode name = child.getChildByFieldName("name");
                TSNode alias = child.getChildByFieldName("alias");
                if (name.isNull() || alias.isNull()) continue;
                table.bind(src.text(alias), new Binding.Origin(dotted(name)));
            }
        }
    }

    /**
     * {@code from X import Y as Z} binds {@code Z} to {@code X.Y}. Relative module names are
     * resolved against the importing file's package; names imported from a module that
     * lies above the corpus root are shadowed.
     */
    public void applyImportFrom(TSNode statement) {
        TSNode moduleNode = statement.getChildByFieldName("module_name");
        if (moduleNode.isNull()) return;
        Optional<String> module = moduleName(moduleNode);

        for (int i = 0; i < statement.getNamedChildCount(); i++) {
            TSNode child = statement.getNamedChild(i);
            if (sameNode(child, moduleNode)) continue;
            switch (child.getType()) {
                case WILDCARD_IMPORT:
                    module.ifPresent(table::addWildcard);
                    break;
                case DOTTED_NAME: {
                    String name = dotted(child);
                    table.bind(name, module.<Binding>map(m -> new Binding.Origin(m + "." + name))
                            .orElse(Binding.SHADOWED));
                    break;
                }
                case ALIASED_IMPORT: {
                    TSNode name = child.getChildByFieldName("name");
                    TSNode alias = child.getChildByFieldName("alias");
                    if (name.isNull() || alias.isNull()) break;
                    String imported = dotted(name);
                    table.bind(src.text(alias), module.<Binding>map(m -> new Binding.Origin(m + "." + imported))
                            .orElse(Binding.SHADOWED));
                    break;
                }
                default:
                    break;
            }
        }
    }

    /**
     * Binding carried by a pure reference expression such as {@code np.zeros}, or null if
     * the expression is anything else. Unbound roots yield a shadowed binding.
     */
    public Binding referenceBinding(TSNode expression) {
        List<String> path = new ArrayList<>();
        TSNode node = expression;
        while (true) {
            String type = node.getType();
            if (ATTRIBUTE.equals(type)) {
                TSNode attr = node.getChildByFieldName("attribute");
                TSNode object = node.getChildByFieldName("object");
                if (attr.isNull() || object.isNull()) return null;
                path.add(0, src.text(attr));
                node = object;
            } else if (PARENTHESIZED.equals(type) && node.getNamedChildCount() == 1) {
                node = node.getNamedChild(0);
            } else {
                break;
            }
        }
        if (!IDENTIFIER.equals(node.getType())) {
            return null;
        }
        AliasTable.Lookup lookup = table.lookup(src.text(node));
        if (!lookup.isBound()) {
            return Binding.SHADOWED;
        }
        return path.isEmpty() ? lookup.binding() : lookup.binding().member(String.join(".", path));
    }

    private Optional<String> moduleName(TSNode moduleNode) {
        if (DOTTED_NAME.equals(moduleNode.getType())) {
            return Optional.of(dotted(moduleNode));
        }
        if (RELATIVE_IMPORT.equals(moduleNode.getType())) {
            int level = 0;
            String module = null;
            for (int i = 0; i < moduleNode.getNamedChildCount(); i++) {
                TSNode part = moduleNode.getNamedChild(i);
                if (IMPORT_PREFIX.equals(part.getType())) {
                    level = src.text(part).trim().length();
                } else if (DOTTED_NAME.equals(part.getType())) {
                    module = dotted(part);
                }
            }
            return ModulePaths.resolveRelative(src.file().relativePath(), Math.max(1, level), module);
        }
        return Optional.empty();
    }

    /** Dotted name text with any inner whitespace or comments removed. */
    private String dotted(TSNode dottedName) {
        if (!DOTTED_NAME.equals(dottedName.getType())) {
            return src.text(dottedName);
        }
        List<String> parts = new ArrayList<>();
        for (int i = 0; i < dottedName.getNamedChildCount(); i++) {
            TSNode part = dottedName.getNamedChild(i);
            if (IDENTIFIER.equals(part.getType())) parts.add(src.text(part));
        }
        return String.join(".", parts);
    }

    static boolean sameNode(TSNode a, TSNode b) {
        return a.getStartByte() == b.getStartByte()
                && a.getEndByte() == b.getEndByte()
                && a.getType().equals(b.getType());
    }
}

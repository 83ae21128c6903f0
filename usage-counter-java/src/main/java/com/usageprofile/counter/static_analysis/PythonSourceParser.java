package com.usageprofile.counter.static_analysis;

import com.usageprofile.counter.corpus.SourceFile;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

/**
 * Wrapper around the tree-sitter Python grammar.
 * Keeps one native parser per thread; a parser is never shared between threads.
 */
public class PythonSourceParser {

    private final long timeoutMicros;
    private final boolean tolerateSyntaxErrors;
    private final ThreadLocal<TSParser> parsers;

    /**
     * @param fileTimeoutMs        parse limit per file, 0 for none
     * @param tolerateSyntaxErrors hand out trees with error nodes instead of failing the file
     */
    public PythonSourceParser(long fileTimeoutMs, boolean tolerateSyntaxErrors) {
        this.timeoutMicros = Math.max(0, fileTimeoutMs) * 1000L;
        this.tolerateSyntaxErrors = tolerateSyntaxErrors;
        this.parsers = ThreadLocal.withInitial(() -> {
            TSParser parser = new TSParser();
            parser.setLanguage(new TreeSitterPython());
            parser.setTimeoutMicros(timeoutMicros);
            return parser;
        });
    }

    public ParseResult parse(SourceFile file) {
        TSParser parser = parsers.get();
        TSTree tree;
        try {
            tree = parser.parseString(null, file.text());
        } catch (RuntimeException e) {
            parser.reset();
            return new ParseResult.Failed(file.relativePath(), 0, 0, "Parser failure: " + e.getMessage());
        }
        if (tree == null) {
            // Only a timeout makes tree-sitter give up on a file
            parser.reset();
            return new ParseResult.Failed(file.relativePath(), 0, 0,
                    "Parse exceeded " + (timeoutMicros / 1000) + " ms");
        }

        TSNode root = tree.getRootNode();
        if (root.hasError() && !tolerateSyntaxErrors) {
            TSNode bad = firstProblem(root);
            if (bad == null) {
                return new ParseResult.Failed(file.relativePath(), 0, 0, "Syntax error");
            }
            String what = bad.isMissing() ? "Missing " + bad.getType() : "Syntax error";
            return new ParseResult.Failed(file.relativePath(), ParsedSource.line(bad), ParsedSource.column(bad), what);
        }
        return new ParseResult.Parsed(new ParsedSource(file, tree));
    }

    /** Leftmost ERROR or MISSING node, searched only below subtrees that contain one. */
    private static TSNode firstProblem(TSNode node) {
        if (PythonNodeTypes.ERROR.equals(node.getType()) || node.isMissing()) {
            return node;
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if (child.isNull()) continue;
            if (child.hasError() || child.isMissing()) {
                TSNode found = firstProblem(child);
                if (found != null) return found;
            }
        }
        return null;
    }
}

package com.usageprofile.counter.static_analysis;

import com.usageprofile.counter.corpus.SourceFile;
import org.treesitter.TSNode;
import org.treesitter.TSTree;

import java.nio.charset.StandardCharsets;

/**
 * A successfully parsed file: its syntax tree plus the UTF-8 bytes the tree's offsets refer to.
 */
public class ParsedSource {

    private final SourceFile file;
    private final TSTree tree;
    private final byte[] utf8;

    ParsedSource(SourceFile file, TSTree tree) {
        this.file = file;
        this.tree = tree;
        this.utf8 = file.text().getBytes(StandardCharsets.UTF_8);
    }

    public SourceFile file() { return file; }

    public TSNode root() { return tree.getRootNode(); }

    /** Source text covered by {@code node}. */
    public String text(TSNode node) {
        int start = node.getStartByte();
        int end = Math.min(node.getEndByte(), utf8.length);
        if (start >= end) return "";
        return new String(utf8, start, end - start, StandardCharsets.UTF_8);
    }

    /** 1-based line of the node's first character. */
    public static int line(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    /** 1-based column (in bytes) of the node's first character. */
    public static int column(TSNode node) {
        return node.getStartPoint().getColumn() + 1;
    }
}

package com.templateformatter.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.templateformatter.ast.Location;
import com.templateformatter.ast.Position;
import com.templateformatter.ast.Range;
import com.templateformatter.ast.Token;
import com.templateformatter.ast.TokenType;

/**
 * Maps character offsets of one source string to line/column positions and cuts tokens.
 */
public final class SourceIndex {
    private final String source;
    private final int[] lineStarts;

    public SourceIndex(String source) {
        this.source = source;
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
    }

    public Position positionAt(int offset) {
        int index = Arrays.binarySearch(lineStarts, offset);
        int line = index >= 0 ? index : -index - 2;
        return new Position(line + 1, offset - lineStarts[line]);
    }

    public Location locationOf(int from, int to) {
        return new Location(positionAt(from), positionAt(to));
    }

    Range rangeOf(int from, int to) {
        return new Range(from, to);
    }

    Token token(int from, int to, TokenType type) {
        return new Token(source.substring(from, to), new Range(from, to), locationOf(from, to), type);
    }

    /**
     * A zero-width token standing in for a terminator the source never provided.
     */
    Token missing(int at) {
        return new Token("", new Range(at, at), locationOf(at, at), TokenType.MISSING);
    }
}

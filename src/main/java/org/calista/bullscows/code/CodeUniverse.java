package org.calista.bullscows.code;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * All 5,040 valid codes in lexicographic order (0123, 0124, ..., 9876).
 * Built once, shared read-only.
 */
public final class CodeUniverse {

    public static final int SIZE = 10 * 9 * 8 * 7;

    private static final List<Code> ALL = build();

    private CodeUniverse() {}

    public static List<Code> all() {
        return ALL;
    }

    private static List<Code> build() {
        ArrayList<Code> out = new ArrayList<>(SIZE);
        for (int a = 0; a <= 9; a++) {
            for (int b = 0; b <= 9; b++) {
                if (b == a) continue;
                for (int c = 0; c <= 9; c++) {
                    if (c == a || c == b) continue;
                    for (int d = 0; d <= 9; d++) {
                        if (d == a || d == b || d == c) continue;
                        out.add(Code.of(a, b, c, d));
                    }
                }
            }
        }
        return Collections.unmodifiableList(out);
    }
}

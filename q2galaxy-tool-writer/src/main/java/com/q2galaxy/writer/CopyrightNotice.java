package com.q2galaxy.writer;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Copyright comment placed first in every generated tool. The year is taken at generation time, which makes it
 * the only field of the output that depends on when it was produced.
 */
public final class CopyrightNotice {

    private CopyrightNotice() {
    }

    public static String forYear(int year) {
        return "\nCopyright (c) " + year + ", QIIME 2 development team.\n"
                + "\n"
                + "Distributed under the terms of the Modified BSD License. (SPDX: BSD-3-Clause)\n";
    }

    public static String current(Clock clock) {
        return forYear(LocalDate.now(clock).getYear());
    }
}

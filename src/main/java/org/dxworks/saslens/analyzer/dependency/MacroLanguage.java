package org.dxworks.saslens.analyzer.dependency;

import java.util.Locale;
import java.util.Set;

/**
 * Names that follow a {@code %} but are part of the macro language rather than user macros.
 */
final class MacroLanguage {

    private static final Set<String> KEYWORDS = Set.of(
            // statements
            "macro", "mend", "let", "if", "then", "else", "do", "end", "to", "by", "while", "until",
            "put", "global", "local", "include", "inc", "goto", "go", "return", "abort", "symdel",
            "syscall", "sysexec", "syslput", "sysrput", "sysmacdelete", "sysmstoreclear", "window",
            "display", "input", "copy", "label", "run", "list", "keydef", "tso", "cms",
            // functions
            "eval", "sysevalf", "sysfunc", "qsysfunc", "str", "nrstr", "quote", "nrquote", "bquote",
            "nrbquote", "superq", "unquote", "upcase", "qupcase", "lowcase", "qlowcase", "substr",
            "qsubstr", "scan", "qscan", "index", "length", "symexist", "symglobl", "symlocal",
            "sysget", "sysprod", "cmpres", "qcmpres", "left", "qleft", "trim", "qtrim",
            "verify", "datatyp", "compstor", "kupcase", "kscan", "ksubstr", "kindex", "klength"
    );

    private MacroLanguage() {
        // utility class
    }

    static boolean isKeyword(String name) {
        return name != null && KEYWORDS.contains(name.toLowerCase(Locale.ROOT));
    }
}

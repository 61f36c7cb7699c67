package io.meld.core.parser;

import io.meld.core.error.DocumentParseException;
import io.meld.core.model.ImportSpecifier;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Parses import lists: {@code *}, {@code name}, {@code name as alias}, {@code name:alias}, comma separated. */
public final class ImportListParser {

    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final String IDENT = "([A-Za-z_][A-Za-z0-9_]*)";
    private static final Pattern AS_ALIAS = Pattern.compile(IDENT + "\\s+as\\s+" + IDENT);
    private static final Pattern COLON_ALIAS = Pattern.compile(IDENT + "\\s*:\\s*" + IDENT);

    private ImportListParser() {}

    /** @throws DocumentParseException for an empty list or a malformed entry */
    public static List<ImportSpecifier> parse(String list) {
        if (list == null || list.isBlank()) {
            throw new DocumentParseException("Import list is empty", null);
        }
        List<ImportSpecifier> result = new ArrayList<>();
        for (String raw : list.split(",", -1)) {
            String entry = raw.trim();
            if (entry.equals("*")) {
                result.add(ImportSpecifier.WILDCARD);
                continue;
            }
            if (NAME.matcher(entry).matches()) {
                result.add(new ImportSpecifier(entry, null));
                continue;
            }
            Matcher m = AS_ALIAS.matcher(entry);
            if (!m.matches()) {
                m = COLON_ALIAS.matcher(entry);
            }
            if (!m.matches()) {
                throw new DocumentParseException("Invalid import list entry: '" + entry + "'", null);
            }
            result.add(new ImportSpecifier(m.group(1), m.group(2)));
        }
        return result;
    }
}

package info.isaksson.erland.seqtoeventb.extract;

import info.isaksson.erland.seqtoeventb.model.DiagramDocument;

import java.util.regex.Pattern;

/**
 * Derives the PascalCase base name used for the context ({@code <Base>Context}) and machine
 * ({@code <Base>InteractionMachine_<n>}).
 *
 * <p>Sources in order: an explicit override, the first diagram page name that is not a default
 * page name, the root element's name, the file name without extension. When none yields an
 * identifier the name is {@value #DEFAULT_NAME}.</p>
 */
public final class BaseNameResolver {

    public static final String DEFAULT_NAME = "System";

    private static final Pattern DEFAULT_PAGE = Pattern.compile("(?i)(page|หน้า)-\\d+");
    private static final Pattern SEPARATORS = Pattern.compile("[^A-Za-z0-9]+");

    public String resolve(DiagramDocument document, String override, ExtractionWarnings warnings) {
        String fromOverride = toPascalCase(override);
        if (!fromOverride.isEmpty()) return fromOverride;

        for (String page : document.diagramNames) {
            if (DEFAULT_PAGE.matcher(page.trim()).matches()) continue;
            String name = toPascalCase(page);
            if (!name.isEmpty()) return name;
        }

        String fromRoot = toPascalCase(document.rootName);
        if (!fromRoot.isEmpty()) return fromRoot;

        String fromFile = toPascalCase(stripExtension(document.fileName));
        if (!fromFile.isEmpty()) {
            warnings.missingName(fromFile, true);
            return fromFile;
        }

        warnings.missingName(DEFAULT_NAME, false);
        return DEFAULT_NAME;
    }

    /**
     * {@code "login flow-v2"} becomes {@code LoginFlowV2}; a leading digit gets an {@code M} prefix.
     * Only ASCII letters and digits survive, so a name written entirely in another script is empty.
     */
    public static String toPascalCase(String text) {
        if (text == null || text.isBlank()) return "";
        StringBuilder sb = new StringBuilder();
        for (String part : SEPARATORS.split(text.trim())) {
            if (part.isEmpty()) continue;
            sb.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
        }
        if (sb.length() > 0 && Character.isDigit(sb.charAt(0))) sb.insert(0, 'M');
        return sb.toString();
    }

    private static String stripExtension(String fileName) {
        if (fileName == null) return null;
        int dot = fileName.indexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}

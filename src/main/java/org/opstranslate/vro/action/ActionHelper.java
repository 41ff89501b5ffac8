package org.opstranslate.vro.action;

import org.opstranslate.vro.action.models.ActionDef;
import org.opstranslate.vro.action.models.ActionInput;
import org.opstranslate.vro.util.XmlHelper;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

public class ActionHelper {
    private static final String SCRIPT_MODULE_ROOT = "dunes-script-module";
    private static final String ACTION_ROOT = "action";
    private static final String ACTION_FILE_SUFFIX = ".action.xml";

    /**
     * Parses a vRO action document into an {@link ActionDef}.
     * Two shapes are understood:
     * <ul>
     *     <li>{@code dunes-script-module}: name, fqn and result type are root attributes,
     *     inputs are {@code param} children with {@code n}/{@code t} attributes</li>
     *     <li>{@code action}: the fully-qualified name is always derived from the file path so that it
     *     matches the {@code System.getModule(...)} calls in workflows; inputs and outputs are nested
     *     under {@code input} and {@code output}</li>
     * </ul>
     *
     * @param actionFile path to the action document
     * @return the parsed action
     * @throws IllegalArgumentException if the root element is not one of the supported shapes
     * @throws IllegalStateException    if the document has no script body
     * @throws RuntimeException         if the file cannot be read or is not well-formed XML
     */
    public static ActionDef parseActionXml(Path actionFile) {
        Document doc = XmlHelper.parseDocument(actionFile);
        Element root = doc.getDocumentElement();
        String rootName = XmlHelper.localName(root);

        String fqName;
        String name;
        String resultType;
        String version;
        List<ActionInput> inputs = new ArrayList<>();

        if (SCRIPT_MODULE_ROOT.equals(rootName)) {
            name = XmlHelper.attributeOrNull(root, "name");
            String declaredFqn = XmlHelper.attributeOrNull(root, "fqn");
            fqName = declaredFqn != null ? declaredFqn : extractFqNameFromPath(actionFile);
            resultType = XmlHelper.attributeOrNull(root, "result-type");
            version = XmlHelper.attributeOrNull(root, "version");

            for (Element param : XmlHelper.childElements(root, "param")) {
                inputs.add(new ActionInput(
                        XmlHelper.attributeOrNull(param, "n"),
                        XmlHelper.attributeOrNull(param, "t"),
                        XmlHelper.childText(param, "description")));
            }
        } else if (ACTION_ROOT.equals(rootName)) {
            fqName = extractFqNameFromPath(actionFile);
            name = fqName.contains("/") ? fqName.substring(fqName.lastIndexOf('/') + 1) : fqName;
            version = XmlHelper.attributeOrNull(root, "version");

            resultType = null;
            Element output = XmlHelper.firstChild(root, "output");
            if (output != null) {
                Element outputParam = XmlHelper.firstChild(output, "param");
                if (outputParam != null) {
                    resultType = XmlHelper.attributeOrNull(outputParam, "type");
                }
            }

            Element input = XmlHelper.firstChild(root, "input");
            if (input != null) {
                for (Element param : XmlHelper.childElements(input, "param")) {
                    inputs.add(new ActionInput(
                            XmlHelper.attributeOrNull(param, "name"),
                            XmlHelper.attributeOrNull(param, "type"),
                            XmlHelper.childText(param, "description")));
                }
            }
        } else {
            throw new IllegalArgumentException(
                    "Unknown action XML format: root tag is '" + rootName + "' in " + actionFile);
        }

        String description = XmlHelper.childText(root, "description");

        String script = XmlHelper.childText(root, "script");
        if (script == null || script.isBlank()) {
            throw new IllegalStateException(
                    String.format("Action '%s' has no script content in %s", name != null ? name : fqName, actionFile));
        }
        script = script.strip();

        String module;
        String shortName;
        int slash = fqName.lastIndexOf('/');
        if (slash >= 0) {
            module = fqName.substring(0, slash);
            shortName = fqName.substring(slash + 1);
        } else {
            module = "";
            shortName = fqName;
        }

        return ActionDef.builder()
                .fqName(fqName)
                .name(name != null ? name : shortName)
                .module(module)
                .script(script)
                .inputs(inputs)
                .resultType(resultType)
                .description(description)
                .sourcePath(actionFile.toString())
                .version(version)
                .sha256(sha256(script))
                .build();
    }

    /**
     * Derives the fully-qualified action name from the file path.
     * <p>
     * {@code actions/com.acme.nsx/createFirewallRule.action.xml -> com.acme.nsx/createFirewallRule}<br>
     * {@code actions/com/acme/nsx/createFirewallRule.action.xml -> com.acme.nsx/createFirewallRule}<br>
     * {@code actions/helper.action.xml -> helper}
     *
     * @param actionFile path to the action document
     * @return the derived fully-qualified name
     */
    public static String extractFqNameFromPath(Path actionFile) {
        List<String> parts = new ArrayList<>();
        for (Path part : actionFile) {
            parts.add(part.toString());
        }

        int actionsIdx = parts.lastIndexOf("actions");
        if (actionsIdx < 0 || actionsIdx == parts.size() - 1) {
            return stripActionSuffix(parts.get(parts.size() - 1));
        }

        List<String> relative = parts.subList(actionsIdx + 1, parts.size());
        String actionName = stripActionSuffix(relative.get(relative.size() - 1));
        if (relative.size() == 1) {
            return actionName;
        }
        String module = String.join(".", relative.subList(0, relative.size() - 1));
        return module + "/" + actionName;
    }

    private static String stripActionSuffix(String fileName) {
        if (fileName.endsWith(ACTION_FILE_SUFFIX)) {
            return fileName.substring(0, fileName.length() - ACTION_FILE_SUFFIX.length());
        }
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    /**
     * Hex encoded SHA-256 of the exact script text.
     */
    static String sha256(String script) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(script.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

package org.carball.fathom.parser;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.carball.fathom.model.Program;
import org.carball.fathom.model.optree.OpFamily;
import org.carball.fathom.model.optree.OpNode;
import org.carball.fathom.model.symbol.CodeObject;
import org.carball.fathom.model.symbol.Namespace;
import org.carball.fathom.model.symbol.SymbolEntry;
import org.carball.fathom.model.symbol.SymbolTable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads an op-tree document exported by a compiler front end. The document carries
 * the program's main op tree, its code objects keyed by id, and its namespaces;
 * symbol entries refer to code objects by id so that several names can share one body.
 */
@Slf4j
public class OpTreeDocumentReader {

    // Every op level costs two levels of nesting: the op object and its children array.
    private static final int MAX_NESTING_DEPTH = 200_000;

    private static final StreamReadConstraints READ_CONSTRAINTS = StreamReadConstraints.builder()
            .maxNestingDepth(MAX_NESTING_DEPTH)
            .build();

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper(JsonFactory.builder()
            .streamReadConstraints(READ_CONSTRAINTS)
            .build());
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(YAMLFactory.builder()
            .loaderOptions(yamlLoaderOptions())
            .streamReadConstraints(READ_CONSTRAINTS)
            .build());

    private OpTreeDocumentReader() {
        // Utility class - prevent instantiation
    }

    private static LoaderOptions yamlLoaderOptions() {
        LoaderOptions options = new LoaderOptions();
        options.setNestingDepthLimit(MAX_NESTING_DEPTH);
        return options;
    }

    public static Program read(Path document) throws IOException {
        if (!Files.exists(document)) {
            throw new IOException("Op-tree document not found: " + document);
        }
        String content = Files.readString(document);
        String fileName = document.getFileName().toString().toLowerCase();
        boolean yaml = fileName.endsWith(".yml") || fileName.endsWith(".yaml");

        log.debug("Reading {} op-tree document {}", yaml ? "YAML" : "JSON", document);
        Program program = yaml ? parseYaml(content) : parseJson(content);
        if ("-".equals(program.name())) {
            return new Program(document.getFileName().toString(), program.mainRoot(), program.symbolTable());
        }
        return program;
    }

    public static Program parseJson(String content) throws JsonProcessingException {
        return toProgram(JSON_MAPPER.readTree(content));
    }

    public static Program parseYaml(String content) throws JsonProcessingException {
        return toProgram(YAML_MAPPER.readTree(content));
    }

    private static Program toProgram(JsonNode document) {
        if (document == null || !document.isObject()) {
            throw new IllegalStateException("Op-tree document must be an object");
        }

        JsonNode main = document.get("main");
        if (main == null || main.isNull()) {
            throw new IllegalStateException("Missing main section in op-tree document");
        }

        String name = textOrNull(document, "program");
        OpNode mainRoot = parseNode(main, "main");
        Map<String, CodeObject> codeObjects = parseCodeObjects(document.get("code"));
        SymbolTable symbolTable = parseSymbolTable(document, codeObjects);

        log.debug("Loaded program {} with {} code objects", name, codeObjects.size());
        return new Program(name, mainRoot, symbolTable);
    }

    /**
     * Builds the op tree rooted at {@code root} without recursion, so documents as deep
     * as the tree walker accepts can be loaded.
     */
    private static OpNode parseNode(JsonNode root, String rootPath) {
        Deque<PendingOp> stack = new ArrayDeque<>();
        stack.push(PendingOp.open(root, rootPath));

        while (true) {
            PendingOp pending = stack.peek();
            if (pending.hasMoreChildren()) {
                int index = pending.nextChild;
                stack.push(PendingOp.open(pending.childNodes.get(index), pending.path + "/" + index));
                pending.nextChild++;
                continue;
            }

            stack.pop();
            OpNode node = new OpNode(pending.op, pending.family, pending.children);
            if (stack.isEmpty()) {
                return node;
            }
            stack.peek().children.add(node);
        }
    }

    private static final class PendingOp {
        private final String path;
        private final String op;
        private final OpFamily family;
        private final JsonNode childNodes;
        private final List<OpNode> children = new ArrayList<>();
        private int nextChild;

        private PendingOp(String path, String op, OpFamily family, JsonNode childNodes) {
            this.path = path;
            this.op = op;
            this.family = family;
            this.childNodes = childNodes;
        }

        static PendingOp open(JsonNode node, String path) {
            if (!node.isObject()) {
                throw new IllegalStateException("Op at " + path + " must be an object");
            }
            String op = textOrNull(node, "op");
            if (op == null || op.isBlank()) {
                throw new IllegalStateException("Missing op name at " + path);
            }

            String familyName = textOrNull(node, "family");
            OpFamily family = OpFamily.fromName(familyName);
            if (familyName != null && !family.name().equalsIgnoreCase(familyName.trim())) {
                log.debug("Unknown op family '{}' at {}, treating as {}", familyName, path, family);
            }

            JsonNode childNodes = node.get("children");
            return new PendingOp(path, op, family,
                    childNodes != null && childNodes.isArray() ? childNodes : null);
        }

        boolean hasMoreChildren() {
            return childNodes != null && nextChild < childNodes.size();
        }
    }

    private static Map<String, CodeObject> parseCodeObjects(JsonNode code) {
        Map<String, CodeObject> codeObjects = new HashMap<>();
        if (code == null || !code.isObject()) {
            return codeObjects;
        }

        Iterator<Map.Entry<String, JsonNode>> fields = code.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode root = field.getValue().get("root");
            OpNode body = root == null || root.isNull()
                    ? null
                    : parseNode(root, "code/" + field.getKey());
            codeObjects.put(field.getKey(), new CodeObject(field.getKey(), body));
        }
        return codeObjects;
    }

    private static SymbolTable parseSymbolTable(JsonNode document, Map<String, CodeObject> codeObjects) {
        JsonNode namespaces = document.get("namespaces");
        String rootName = textOrNull(document, "root_namespace");
        if (rootName == null) {
            rootName = SymbolTable.DEFAULT_ROOT;
        }

        if (namespaces == null || !namespaces.isObject() || namespaces.isEmpty()) {
            return new SymbolTable(new Namespace(rootName));
        }

        // First pass: create every namespace so nested references (including cycles) resolve
        Map<String, Namespace> byName = new LinkedHashMap<>();
        namespaces.fieldNames().forEachRemaining(nsName -> byName.put(nsName, new Namespace(nsName)));

        if (!byName.containsKey(rootName)) {
            throw new IllegalStateException("Root namespace '" + rootName + "' is not declared");
        }

        // Second pass: entries and nested namespace references
        for (Map.Entry<String, Namespace> declared : byName.entrySet()) {
            JsonNode nsNode = namespaces.get(declared.getKey());
            Namespace namespace = declared.getValue();

            JsonNode entries = nsNode.get("entries");
            if (entries != null && entries.isArray()) {
                for (JsonNode entry : entries) {
                    namespace.addEntry(parseEntry(entry, namespace, codeObjects));
                }
            }

            JsonNode nested = nsNode.get("namespaces");
            if (nested != null && nested.isArray()) {
                for (JsonNode ref : nested) {
                    Namespace child = byName.get(ref.asText());
                    if (child == null) {
                        log.warn("Namespace {} refers to undeclared namespace '{}', ignoring",
                                namespace.getName(), ref.asText());
                        continue;
                    }
                    namespace.addNamespace(child);
                }
            }
        }

        return new SymbolTable(byName.get(rootName));
    }

    private static SymbolEntry parseEntry(JsonNode entry, Namespace namespace, Map<String, CodeObject> codeObjects) {
        String name = textOrNull(entry, "name");
        if (name == null) {
            throw new IllegalStateException("Symbol entry without a name in namespace " + namespace.getName());
        }

        String codeRef = textOrNull(entry, "code");
        if (codeRef == null) {
            return SymbolEntry.data(name);
        }

        CodeObject code = codeObjects.get(codeRef);
        return code != null ? SymbolEntry.code(name, code) : SymbolEntry.unresolved(name, codeRef);
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}

package org.irlens.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.irlens.api.IrCodecException;
import org.irlens.compare.MismatchReason;
import org.irlens.compare.MismatchRecord;
import org.irlens.ir.IrArena;
import org.irlens.ir.IrNode;
import org.irlens.ir.IrValue;
import org.irlens.path.NodePath;
import org.irlens.path.Segment;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON encoding of trees, node paths and mismatch records, so that they can cross process
 * boundaries (into an error-reporting service, a test fixture file, a log line).
 * <p>
 * Every node gets a numeric {@code id} on first appearance. A node object that occurs again
 * is written as {@code {"ref": id}}, so decoding rebuilds one shared node rather than a copy
 * and identity-based requests still find every use-site. Mapping keys inside paths are
 * written as self-contained trees.
 * <pre>
 * {"id":0,"kind":"for","fields":{"loop_var":{"id":1,...},...}}
 * {"id":5,"seq":[...]}     {"id":6,"map":[{"key":...,"value":...}]}
 * {"id":7,"leaf":{"type":"int","value":128}}     {"ref":1}
 * </pre>
 */
public class IrJsonCodec {

    private final ObjectMapper objectMapper = new ObjectMapper();

    // region Trees

    /**
     * @param root The tree to encode.
     * @return Its JSON form.
     */
    public String encodeTree(IrNode root) {
        return write(treeNode(root));
    }

    public JsonNode treeNode(IrNode root) {
        return new TreeEncoder().node(root);
    }

    /**
     * Decodes a tree, allocating its nodes in the given arena.
     *
     * @param json A document produced by {@link #encodeTree(IrNode)}.
     * @param arena The arena to allocate into.
     * @return The root node.
     * @throws IrCodecException if the document does not describe a tree.
     */
    public IrNode decodeTree(String json, IrArena arena) throws IrCodecException {
        return new TreeDecoder(arena).node(read(json), "$");
    }

    // endregion

    // region Paths and mismatch records

    public String encodePath(NodePath path) {
        return write(pathNode(path));
    }

    public NodePath decodePath(String json, IrArena arena) throws IrCodecException {
        return path(read(json), arena, "$");
    }

    public String encodeMismatch(MismatchRecord mismatch) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("reason", mismatch.reason().name());
        node.set("lhs", pathNode(mismatch.lhsPath()));
        node.set("rhs", pathNode(mismatch.rhsPath()));
        return write(node);
    }

    public MismatchRecord decodeMismatch(String json, IrArena arena) throws IrCodecException {
        JsonNode node = read(json);
        requireObject(node, "$");
        String reason = text(node, "reason", "$");
        MismatchReason parsed;
        try {
            parsed = MismatchReason.valueOf(reason);
        } catch (IllegalArgumentException e) {
            throw new IrCodecException("Unknown mismatch reason '" + reason + "' at $.reason", e);
        }
        return new MismatchRecord(path(node.get("lhs"), arena, "$.lhs"), path(node.get("rhs"), arena, "$.rhs"), parsed);
    }

    private ArrayNode pathNode(NodePath path) {
        ArrayNode array = objectMapper.createArrayNode();
        for (Segment segment : path.segments()) {
            ObjectNode step = array.addObject();
            if (segment instanceof Segment.Field field) {
                step.put("field", field.name());
            } else if (segment instanceof Segment.Attr attr) {
                step.put("attr", attr.name());
            } else if (segment instanceof Segment.Index index) {
                step.put("index", index.index());
            } else if (segment instanceof Segment.Key key) {
                step.set("key", treeNode(key.key()));
            }
        }
        return array;
    }

    private NodePath path(JsonNode node, IrArena arena, String location) throws IrCodecException {
        if (node == null || !node.isArray()) {
            throw new IrCodecException("Expected a path array at " + location);
        }
        List<Segment> segments = new ArrayList<>();
        for (int i = 0; i < node.size(); i++) {
            JsonNode step = node.get(i);
            String at = location + "[" + i + "]";
            requireObject(step, at);
            if (step.has("field")) {
                segments.add(new Segment.Field(text(step, "field", at)));
            } else if (step.has("attr")) {
                segments.add(new Segment.Attr(text(step, "attr", at)));
            } else if (step.has("index")) {
                JsonNode index = step.get("index");
                if (!index.canConvertToInt() || index.intValue() < 0) {
                    throw new IrCodecException("Expected a non-negative index at " + at);
                }
                segments.add(new Segment.Index(index.intValue()));
            } else if (step.has("key")) {
                segments.add(new Segment.Key(new TreeDecoder(arena).node(step.get("key"), at + ".key")));
            } else {
                throw new IrCodecException("Unknown path segment at " + at);
            }
        }
        return NodePath.of(segments);
    }

    // endregion

    private String write(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize JSON tree", e);
        }
    }

    private JsonNode read(String json) throws IrCodecException {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IrCodecException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static void requireObject(JsonNode node, String location) throws IrCodecException {
        if (node == null || !node.isObject()) {
            throw new IrCodecException("Expected an object at " + location);
        }
    }

    private static String text(JsonNode node, String field, String location) throws IrCodecException {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new IrCodecException("Expected a string '" + field + "' at " + location);
        }
        return value.textValue();
    }

    private final class TreeEncoder {
        private final Map<IrNode, Integer> ids = new IdentityHashMap<>();

        ObjectNode node(IrNode node) {
            ObjectNode out = objectMapper.createObjectNode();
            Integer seen = ids.get(node);
            if (seen != null) {
                out.put("ref", seen);
                return out;
            }
            ids.put(node, ids.size());
            out.put("id", ids.get(node));
            if (node instanceof IrNode.Leaf leaf) {
                out.set("leaf", value(leaf.value()));
            } else if (node instanceof IrNode.Composite composite) {
                out.put("kind", composite.kind());
                ObjectNode fields = out.putObject("fields");
                composite.fields().forEach((name, child) -> fields.set(name, node(child)));
            } else if (node instanceof IrNode.Sequence sequence) {
                ArrayNode elements = out.putArray("seq");
                for (IrNode element : sequence.elements()) elements.add(node(element));
            } else if (node instanceof IrNode.Mapping mapping) {
                ArrayNode entries = out.putArray("map");
                for (IrNode.Mapping.Entry entry : mapping.entries()) {
                    ObjectNode pair = entries.addObject();
                    pair.set("key", node(entry.key()));
                    pair.set("value", node(entry.value()));
                }
            }
            return out;
        }

        private ObjectNode value(IrValue value) {
            ObjectNode out = objectMapper.createObjectNode();
            out.put("type", value.kindName());
            if (value instanceof IrValue.Int64 i) {
                out.put("value", i.value());
            } else if (value instanceof IrValue.Float64 f) {
                if (Double.isFinite(f.value())) {
                    out.put("value", f.value());
                } else {
                    out.put("value", Double.toString(f.value()));
                }
            } else if (value instanceof IrValue.Str s) {
                out.put("value", s.value());
            } else if (value instanceof IrValue.Bool b) {
                out.put("value", b.value());
            } else if (value instanceof IrValue.Handle h) {
                out.put("handleType", h.type());
                out.put("value", h.id());
            }
            return out;
        }
    }

    private static final class TreeDecoder {
        private final IrArena arena;
        private final Map<Integer, IrNode> byId = new HashMap<>();

        TreeDecoder(IrArena arena) {
            this.arena = arena;
        }

        IrNode node(JsonNode json, String location) throws IrCodecException {
            requireObject(json, location);
            if (json.has("ref")) {
                IrNode target = byId.get(json.get("ref").asInt(-1));
                if (target == null) {
                    throw new IrCodecException("Reference to an unknown or enclosing node at " + location);
                }
                return target;
            }
            JsonNode id = json.get("id");
            if (id == null || !id.canConvertToInt()) {
                throw new IrCodecException("Expected an integer 'id' at " + location);
            }
            if (byId.containsKey(id.intValue())) {
                throw new IrCodecException("Duplicate node id " + id.intValue() + " at " + location);
            }
            IrNode node;
            if (json.has("leaf")) {
                node = arena.leaf(value(json.get("leaf"), location + ".leaf"));
            } else if (json.has("kind")) {
                String kind = text(json, "kind", location);
                JsonNode fields = json.get("fields");
                requireObject(fields, location + ".fields");
                Map<String, IrNode> children = new LinkedHashMap<>();
                Iterator<Map.Entry<String, JsonNode>> it = fields.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> field = it.next();
                    children.put(field.getKey(), node(field.getValue(), location + ".fields." + field.getKey()));
                }
                node = arena.composite(kind, children);
            } else if (json.has("seq")) {
                JsonNode elements = json.get("seq");
                if (!elements.isArray()) throw new IrCodecException("Expected an array at " + location + ".seq");
                List<IrNode> children = new ArrayList<>();
                for (int i = 0; i < elements.size(); i++) {
                    children.add(node(elements.get(i), location + ".seq[" + i + "]"));
                }
                node = arena.sequence(children);
            } else if (json.has("map")) {
                JsonNode entries = json.get("map");
                if (!entries.isArray()) throw new IrCodecException("Expected an array at " + location + ".map");
                List<IrNode.Mapping.Entry> children = new ArrayList<>();
                for (int i = 0; i < entries.size(); i++) {
                    JsonNode pair = entries.get(i);
                    String at = location + ".map[" + i + "]";
                    requireObject(pair, at);
                    IrNode key = node(pair.get("key"), at + ".key");
                    IrNode value = node(pair.get("value"), at + ".value");
                    children.add(IrArena.entry(key, value));
                }
                node = arena.mapping(children);
            } else {
                throw new IrCodecException("Node at " + location + " is neither leaf, composite, sequence nor mapping");
            }
            byId.put(id.intValue(), node);
            return node;
        }

        private IrValue value(JsonNode json, String location) throws IrCodecException {
            requireObject(json, location);
            String type = text(json, "type", location);
            JsonNode value = json.get("value");
            if (value == null) throw new IrCodecException("Missing 'value' at " + location);
            switch (type) {
                case "int":
                    if (!value.canConvertToLong() || !value.isIntegralNumber()) break;
                    return new IrValue.Int64(value.longValue());
                case "float":
                    if (value.isNumber()) return new IrValue.Float64(value.doubleValue());
                    if (value.isTextual()) {
                        try {
                            return new IrValue.Float64(Double.parseDouble(value.textValue()));
                        } catch (NumberFormatException e) {
                            throw new IrCodecException("Invalid float at " + location, e);
                        }
                    }
                    break;
                case "str":
                    if (value.isTextual()) return new IrValue.Str(value.textValue());
                    break;
                case "bool":
                    if (value.isBoolean()) return new IrValue.Bool(value.booleanValue());
                    break;
                case "handle":
                    if (value.isIntegralNumber()) return new IrValue.Handle(text(json, "handleType", location), value.longValue());
                    break;
                default:
                    throw new IrCodecException("Unknown leaf type '" + type + "' at " + location);
            }
            throw new IrCodecException("Value does not match leaf type '" + type + "' at " + location);
        }
    }
}

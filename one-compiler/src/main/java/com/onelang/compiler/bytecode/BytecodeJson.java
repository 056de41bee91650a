package com.onelang.compiler.bytecode;

import com.google.gson.*;
import com.onelang.compiler.lexer.SourceLocation;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 字节码模块的 JSON 持久化
 *
 * <p>格式：</p>
 * <pre>
 * {
 *   "entryPoint": "main",
 *   "functions": [
 *     { "name": "add", "params": ["a", "b"], "constants": [...],
 *       "instructions": [ { "op": "LOAD_VAR", "operand": "a", "location": {...} }, ... ] }
 *   ]
 * }
 * </pre>
 * <p>常量带类型标签（{@code long}/{@code double}/{@code string}/{@code boolean}/{@code null}），
 * 保证整数与浮点数往返后不混淆。</p>
 */
public final class BytecodeJson {

    private final Gson gson;

    public BytecodeJson() {
        this.gson = new GsonBuilder()
                .serializeNulls()
                .serializeSpecialFloatingPointValues()
                .setPrettyPrinting()
                .create();
    }

    // ============ 写出 ============

    public String toJson(BytecodeModule module) {
        return gson.toJson(encodeModule(module));
    }

    public void write(BytecodeModule module, Path file) throws IOException {
        Files.write(file, toJson(module).getBytes(StandardCharsets.UTF_8));
    }

    JsonObject encodeModule(BytecodeModule module) {
        JsonObject root = new JsonObject();
        root.addProperty("entryPoint", module.getEntryPoint());
        JsonArray functions = new JsonArray();
        for (CompiledFunction function : module.getFunctions().values()) {
            functions.add(encodeFunction(function));
        }
        root.add("functions", functions);
        return root;
    }

    private JsonObject encodeFunction(CompiledFunction function) {
        JsonObject obj = new JsonObject();
        obj.addProperty("name", function.getName());

        JsonArray params = new JsonArray();
        for (String param : function.getParamNames()) {
            params.add(param);
        }
        obj.add("params", params);

        JsonArray constants = new JsonArray();
        for (Object constant : function.getConstants()) {
            constants.add(encodeConstant(constant));
        }
        obj.add("constants", constants);

        JsonArray instructions = new JsonArray();
        for (Instruction inst : function.getInstructions()) {
            instructions.add(encodeInstruction(inst));
        }
        obj.add("instructions", instructions);
        return obj;
    }

    private JsonObject encodeInstruction(Instruction inst) {
        JsonObject obj = new JsonObject();
        obj.addProperty("op", inst.getOpcode().name());

        switch (inst.getOpcode().getOperandKind()) {
            case NONE:
                break;
            case CONSTANT:
                obj.add("operand", encodeConstant(inst.getOperand()));
                break;
            case NAME:
                obj.addProperty("operand", inst.getName());
                break;
            case JUMP_TARGET:
                obj.addProperty("operand", inst.getJumpTarget());
                break;
            case CALL: {
                CallTarget target = inst.getCallTarget();
                JsonObject call = new JsonObject();
                call.addProperty("name", target.getName());
                call.addProperty("argc", target.getArgCount());
                obj.add("operand", call);
                break;
            }
            case COUNT:
                obj.addProperty("operand", inst.getCount());
                break;
        }

        SourceLocation loc = inst.getLocation();
        if (loc != null) {
            JsonObject location = new JsonObject();
            location.addProperty("file", loc.getFile());
            location.addProperty("line", loc.getLine());
            location.addProperty("column", loc.getColumn());
            obj.add("location", location);
        }
        return obj;
    }

    private JsonObject encodeConstant(Object value) {
        JsonObject obj = new JsonObject();
        if (value == null) {
            obj.addProperty("type", "null");
        } else if (value instanceof Long) {
            obj.addProperty("type", "long");
            obj.addProperty("value", (Long) value);
        } else if (value instanceof Double) {
            obj.addProperty("type", "double");
            obj.addProperty("value", (Double) value);
        } else if (value instanceof String) {
            obj.addProperty("type", "string");
            obj.addProperty("value", (String) value);
        } else if (value instanceof Boolean) {
            obj.addProperty("type", "boolean");
            obj.addProperty("value", (Boolean) value);
        } else {
            throw new IllegalArgumentException("Unsupported constant type: " + value.getClass().getName());
        }
        return obj;
    }

    // ============ 读入 ============

    /**
     * @throws JsonParseException JSON 不合法或结构不符合上述格式
     */
    public BytecodeModule fromJson(String json) {
        JsonObject root = gson.fromJson(json, JsonObject.class);
        if (root == null) {
            throw new JsonParseException("Empty bytecode document");
        }
        return decodeModule(root);
    }

    public BytecodeModule read(Path file) throws IOException {
        return fromJson(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
    }

    BytecodeModule decodeModule(JsonObject root) {
        BytecodeModule module = new BytecodeModule(requireString(root, "entryPoint"));
        for (JsonElement fn : requireArray(root, "functions")) {
            module.addFunction(decodeFunction(fn.getAsJsonObject()));
        }
        return module;
    }

    private CompiledFunction decodeFunction(JsonObject obj) {
        String name = requireString(obj, "name");

        List<String> params = new ArrayList<String>();
        for (JsonElement p : requireArray(obj, "params")) {
            params.add(p.getAsString());
        }

        List<Object> constants = new ArrayList<Object>();
        if (obj.has("constants")) {
            for (JsonElement c : obj.getAsJsonArray("constants")) {
                constants.add(decodeConstant(c.getAsJsonObject()));
            }
        }

        List<Instruction> instructions = new ArrayList<Instruction>();
        for (JsonElement i : requireArray(obj, "instructions")) {
            instructions.add(decodeInstruction(i.getAsJsonObject()));
        }
        return new CompiledFunction(name, params, instructions, constants);
    }

    private Instruction decodeInstruction(JsonObject obj) {
        String opName = requireString(obj, "op");
        OpCode opcode;
        try {
            opcode = OpCode.valueOf(opName);
        } catch (IllegalArgumentException e) {
            throw new JsonParseException("Unknown opcode: " + opName, e);
        }

        Object operand = null;
        JsonElement raw = obj.get("operand");
        switch (opcode.getOperandKind()) {
            case NONE:
                break;
            case CONSTANT:
                operand = decodeConstant(requireObject(obj, "operand"));
                break;
            case NAME:
                operand = requireString(obj, "operand");
                break;
            case JUMP_TARGET:
            case COUNT:
                if (raw == null || !raw.isJsonPrimitive()) {
                    throw new JsonParseException(opcode + " requires an integer operand");
                }
                operand = raw.getAsInt();
                break;
            case CALL: {
                JsonObject call = requireObject(obj, "operand");
                operand = new CallTarget(requireString(call, "name"), call.get("argc").getAsInt());
                break;
            }
        }

        SourceLocation location = null;
        if (obj.has("location") && obj.get("location").isJsonObject()) {
            JsonObject loc = obj.getAsJsonObject("location");
            location = new SourceLocation(loc.get("file").getAsString(),
                    loc.get("line").getAsInt(), loc.get("column").getAsInt());
        }
        return new Instruction(opcode, operand, location);
    }

    private Object decodeConstant(JsonObject obj) {
        String type = requireString(obj, "type");
        switch (type) {
            case "null": return null;
            case "long": return obj.get("value").getAsLong();
            case "double": return obj.get("value").getAsDouble();
            case "string": return obj.get("value").getAsString();
            case "boolean": return obj.get("value").getAsBoolean();
            default:
                throw new JsonParseException("Unknown constant type: " + type);
        }
    }

    // ============ 辅助方法 ============

    private static String requireString(JsonObject obj, String key) {
        JsonElement e = obj.get(key);
        if (e == null || !e.isJsonPrimitive()) {
            throw new JsonParseException("Missing string field '" + key + "'");
        }
        return e.getAsString();
    }

    private static JsonArray requireArray(JsonObject obj, String key) {
        JsonElement e = obj.get(key);
        if (e == null || !e.isJsonArray()) {
            throw new JsonParseException("Missing array field '" + key + "'");
        }
        return e.getAsJsonArray();
    }

    private static JsonObject requireObject(JsonObject obj, String key) {
        JsonElement e = obj.get(key);
        if (e == null || !e.isJsonObject()) {
            throw new JsonParseException("Missing object field '" + key + "'");
        }
        return e.getAsJsonObject();
    }
}

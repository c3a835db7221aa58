package org.shadelang.backend.bytecode;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import org.shadelang.runtime.builtins.BuiltinFunction;

import java.util.Map;

/**
 * Writes the symbol-level metadata of a compiled program as JSON, for hosts that
 * bind in/out parameters and entry points by name.
 */
public final class ProgramMetadataWriter {

    private ProgramMetadataWriter() {
    }

    public static JSONObject toJsonObject(CompiledProgram program) {
        JSONObject json = new JSONObject();
        json.put("staticSectionSize", program.getStaticSectionSize());
        json.put("minStackSize", program.getMinStackSize());
        json.put("codeLength", program.codeLength());

        JSONObject globals = new JSONObject();
        for (Map.Entry<String, SymbolMeta> entry : program.getGlobalSymbols().entrySet()) {
            globals.put(entry.getKey(), symbol(entry.getValue()));
        }
        json.put("globals", globals);

        JSONObject functions = new JSONObject();
        for (FuncMeta function : program.getFunctions().values()) {
            JSONObject fn = new JSONObject();
            fn.put("address", function.getAddress());
            fn.put("returnType", function.getReturnType().keyword());
            fn.put("frameSize", function.getFrameSize());
            JSONObject locals = new JSONObject();
            for (Map.Entry<String, SymbolMeta> entry : function.getSymbols().entrySet()) {
                locals.put(entry.getKey(), symbol(entry.getValue()));
            }
            fn.put("locals", locals);
            functions.put(function.getName(), fn);
        }
        json.put("functions", functions);

        JSONArray imports = new JSONArray();
        for (BuiltinFunction function : program.getNativeImports()) {
            imports.add(function.handle());
        }
        json.put("nativeImports", imports);
        return json;
    }

    public static String toJson(CompiledProgram program, boolean indent) {
        JSONWriter.Feature[] features = indent ? new JSONWriter.Feature[]{JSONWriter.Feature.PrettyFormat} : new JSONWriter.Feature[0];
        return JSON.toJSONString(toJsonObject(program), features);
    }

    private static JSONObject symbol(SymbolMeta meta) {
        JSONObject json = new JSONObject();
        json.put("offset", meta.offset());
        json.put("static", meta.isStatic());
        json.put("type", meta.typeKind().keyword());
        return json;
    }
}

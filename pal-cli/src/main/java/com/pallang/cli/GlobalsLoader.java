package com.pallang.cli;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import pal.runtime.PalAlgorithm;
import pal.runtime.PalArray;
import pal.runtime.PalBoolean;
import pal.runtime.PalNil;
import pal.runtime.PalNumber;
import pal.runtime.PalPath;
import pal.runtime.PalString;
import pal.runtime.PalValue;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 从 JSON 对象加载预置全局变量
 *
 * <p>布尔、数值、null 与数组直接映射；字符串默认为 String，
 * 键名为 {@code session}/{@code sample} 时为 Path，为 {@code algorithm} 时为 Algorithm。</p>
 */
public final class GlobalsLoader {

    private GlobalsLoader() {
    }

    /**
     * @throws IOException        文件无法读取
     * @throws JsonParseException 不是合法的 JSON 对象或包含不支持的值
     */
    public static Map<String, PalValue> load(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return fromJson(JsonParser.parseReader(reader));
        }
    }

    public static Map<String, PalValue> parse(String json) {
        return fromJson(JsonParser.parseString(json));
    }

    private static Map<String, PalValue> fromJson(JsonElement root) {
        if (!root.isJsonObject()) {
            throw new JsonParseException("Globals file must contain a JSON object");
        }
        JsonObject object = root.getAsJsonObject();
        Map<String, PalValue> globals = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
            globals.put(entry.getKey(), toValue(entry.getKey(), entry.getValue()));
        }
        return globals;
    }

    static PalValue toValue(String name, JsonElement element) {
        if (element.isJsonNull()) {
            return PalNil.NIL;
        }
        if (element.isJsonArray()) {
            JsonArray array = element.getAsJsonArray();
            PalArray result = new PalArray();
            for (JsonElement item : array) {
                result.append(toValue("", item));
            }
            return result;
        }
        if (element.isJsonPrimitive()) {
            JsonPrimitive primitive = element.getAsJsonPrimitive();
            if (primitive.isBoolean()) {
                return PalBoolean.of(primitive.getAsBoolean());
            }
            if (primitive.isNumber()) {
                return PalNumber.of(primitive.getAsDouble());
            }
            String text = primitive.getAsString();
            switch (name) {
                case "session":
                case "sample":
                    return PalPath.of(text);
                case "algorithm":
                    try {
                        return PalAlgorithm.of(text);
                    } catch (IllegalArgumentException e) {
                        throw new JsonParseException(e.getMessage(), e);
                    }
                default:
                    return PalString.of(text);
            }
        }
        throw new JsonParseException("Unsupported value for '" + name + "': nested objects are not allowed");
    }
}

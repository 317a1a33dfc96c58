package com.bioterminal.core.config;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.IntConsumer;

/**
 * SnakeYAML 공용 헬퍼. 로드는 항상 SafeConstructor(임의 타입 생성 금지).
 * setXxx 헬퍼는 키가 없으면 아무것도 하지 않는다(기본값 유지).
 */
public final class YamlSupport {
    private YamlSupport() {}

    public static Yaml safeYaml() {
        return new Yaml(new SafeConstructor(new LoaderOptions()));
    }

    public static Yaml blockDumper() {
        DumperOptions opts = new DumperOptions();
        opts.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        opts.setIndent(2);
        opts.setPrettyFlow(true);
        return new Yaml(opts);
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = (map == null) ? null : map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    public static List<?> getList(Map<?, ?> map, String key) {
        Object v = (map == null) ? null : map.get(key);
        return (v instanceof List<?> l) ? l : null;
    }

    public static String getString(Map<?, ?> map, String key) {
        Object v = (map == null) ? null : map.get(key);
        return (v == null) ? null : String.valueOf(v);
    }

    public static boolean getBoolean(Map<?, ?> map, String key, boolean def) {
        Object v = (map == null) ? null : map.get(key);
        if (v instanceof Boolean b) return b;
        if (v == null) return def;
        return Boolean.parseBoolean(String.valueOf(v).trim());
    }

    public static double getDouble(Map<?, ?> map, String key, double def) {
        Object v = (map == null) ? null : map.get(key);
        if (v instanceof Number n) return n.doubleValue();
        if (v == null) return def;
        try {
            return Double.parseDouble(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + key + "' is not a number: " + v, e);
        }
    }

    public static int getInt(Map<?, ?> map, String key, int def) {
        Object v = (map == null) ? null : map.get(key);
        if (v instanceof Number n) return n.intValue();
        if (v == null) return def;
        try {
            return Integer.parseInt(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + key + "' is not an integer: " + v, e);
        }
    }

    public static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        String v = getString(map, key);
        if (v != null) setter.accept(v);
    }

    public static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        if (map != null && map.get(key) != null) setter.accept(getBoolean(map, key, false));
    }

    public static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        if (map != null && map.get(key) != null) setter.accept(getInt(map, key, 0));
    }

    public static void setDouble(Map<?, ?> map, String key, DoubleConsumer setter) {
        if (map != null && map.get(key) != null) setter.accept(getDouble(map, key, 0));
    }

    /** 리스트 또는 "a,b,c" 문자열 */
    public static List<String> getStringList(Map<?, ?> map, String key) {
        Object v = (map == null) ? null : map.get(key);
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o).trim());
        } else if (v != null) {
            for (String p : String.valueOf(v).split("\\s*,\\s*")) if (!p.isBlank()) out.add(p.trim());
        }
        return out;
    }
}

package xyz.vvrf.cfg.core;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * 节点或边上的 DOT 属性集合 (字符串键值对，键唯一)。
 * 遍历顺序始终按键的字典序，保证渲染结果与插入顺序无关。
 *
 * @author ruifeng.wen
 */
public final class AttributeMap {

    public static final String LABEL = "label";
    public static final String COLOR = "color";

    private final TreeMap<String, String> entries = new TreeMap<>();

    public AttributeMap() {
    }

    /**
     * 创建给定属性集合的独立副本。
     */
    public static AttributeMap copyOf(AttributeMap other) {
        AttributeMap copy = new AttributeMap();
        copy.entries.putAll(other.entries);
        return copy;
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * 获取属性值，不存在时返回空字符串。
     */
    public String getOrEmpty(String key) {
        return entries.getOrDefault(key, "");
    }

    public AttributeMap put(String key, String value) {
        Objects.requireNonNull(key, "属性键不能为空");
        Objects.requireNonNull(value, "属性 '" + key + "' 的值不能为空");
        entries.put(key, value);
        return this;
    }

    public AttributeMap putAll(AttributeMap other) {
        entries.putAll(other.entries);
        return this;
    }

    public Optional<String> remove(String key) {
        return Optional.ofNullable(entries.remove(key));
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    /**
     * 按键字典序排列的只读视图。
     */
    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(entries);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return entries.equals(((AttributeMap) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}

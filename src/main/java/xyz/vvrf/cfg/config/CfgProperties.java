package xyz.vvrf.cfg.config;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * 控制流图库的配置属性。
 * 绑定 'cfg' 前缀下的属性：先读取 classpath 上的 {@code cfg-default.properties}，
 * 再由可选的 {@code cfg.properties} 覆盖。
 *
 * @author ruifeng.wen
 */
@Slf4j
@Getter
@Setter
public class CfgProperties {

    public static final String DEFAULT_RESOURCE = "cfg-default.properties";
    public static final String OVERRIDE_RESOURCE = "cfg.properties";

    private final Dot dot = new Dot();

    @Getter
    @Setter
    public static class Dot {
        /**
         * DOT 输出中每条语句的缩进，只能是空白字符。
         */
        private String indent = "\t";

        /**
         * DOT 输出中每一行的前缀，只能是空白字符。
         */
        private String prefix = "";
    }

    /**
     * 从 classpath 加载默认配置及覆盖配置。
     *
     * @throws UncheckedIOException 如果配置资源存在但无法读取
     */
    public static CfgProperties load() {
        Properties props = new Properties();
        readResource(DEFAULT_RESOURCE, props);
        readResource(OVERRIDE_RESOURCE, props);
        return from(props);
    }

    /**
     * 从给定的属性集合创建配置，缺失的键使用内置默认值。
     */
    public static CfgProperties from(Properties props) {
        CfgProperties result = new CfgProperties();
        result.dot.indent = props.getProperty("cfg.dot.indent", result.dot.indent);
        result.dot.prefix = props.getProperty("cfg.dot.prefix", result.dot.prefix);
        return result;
    }

    private static void readResource(String name, Properties target) {
        ClassLoader loader = CfgProperties.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(name)) {
            if (in == null) {
                log.debug("配置资源 '{}' 不存在, 跳过", name);
                return;
            }
            target.load(in);
            log.debug("已加载配置资源 '{}'", name);
        } catch (IOException e) {
            throw new UncheckedIOException("无法读取配置资源 '" + name + "'", e);
        }
    }

    @Override
    public String toString() {
        return "CfgProperties{" +
                "dot={indent='" + dot.indent.replace("\t", "\\t") + '\'' +
                ", prefix='" + dot.prefix + '\'' +
                "}}";
    }
}

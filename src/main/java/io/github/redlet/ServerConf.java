package io.github.redlet;

import java.net.InetSocketAddress;
import java.util.Properties;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 服务配置，从系统属性读取：
 * <ul>
 * <li>redlet.host 监听地址，默认0.0.0.0</li>
 * <li>redlet.port 监听端口，默认6379</li>
 * <li>redlet.threads io线程数，默认20</li>
 * <li>redlet.address host:port格式的监听地址，设置后覆盖redlet.host和redlet.port</li>
 * </ul>
 *
 * @author zy
 */
@Builder
@ToString
public class ServerConf {
    public static final String HOST_PROPERTY    = "redlet.host";
    public static final String PORT_PROPERTY    = "redlet.port";
    public static final String THREADS_PROPERTY = "redlet.threads";
    public static final String ADDRESS_PROPERTY = "redlet.address";

    @Builder.Default
    @Getter
    private String host = "0.0.0.0";

    @Builder.Default
    @Getter
    private int port = 6379;

    @Builder.Default
    @Getter
    private int threads = 20;

    public static ServerConf fromProperties(Properties props) {
        ServerConfBuilder builder = ServerConf.builder();
        String host = props.getProperty(HOST_PROPERTY);
        if (!Strings.isNullOrEmpty(host)) {
            builder.host(host.trim());
        }
        String port = props.getProperty(PORT_PROPERTY);
        if (!Strings.isNullOrEmpty(port)) {
            builder.port(parseInt(PORT_PROPERTY, port));
        }
        String threads = props.getProperty(THREADS_PROPERTY);
        if (!Strings.isNullOrEmpty(threads)) {
            builder.threads(parseInt(THREADS_PROPERTY, threads));
        }
        String address = props.getProperty(ADDRESS_PROPERTY);
        if (!Strings.isNullOrEmpty(address)) {
            InetSocketAddress socketAddress = parseAddress(address.trim());
            builder.host(socketAddress.getHostString()).port(socketAddress.getPort());
        }
        return builder.build().validate();
    }

    /**
     * 解析host:port格式的地址
     *
     * @param address 地址，如127.0.0.1:6379
     * @return socket地址
     * @throws IllegalArgumentException 格式错误
     */
    public static InetSocketAddress parseAddress(String address) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(address), "address is empty");
        int i = address.lastIndexOf(':');
        Preconditions.checkArgument(i > 0 && i < address.length() - 1, "address must be host:port, but got %s", address);
        int port = parseInt("port", address.substring(i + 1));
        checkPort(port);
        return new InetSocketAddress(address.substring(0, i), port);
    }

    public InetSocketAddress getSocketAddress() {
        return new InetSocketAddress(host, port);
    }

    ServerConf validate() {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(host), "%s is empty", HOST_PROPERTY);
        checkPort(port);
        Preconditions.checkArgument(threads > 0, "%s must be positive, but got %s", THREADS_PROPERTY, threads);
        return this;
    }

    private static void checkPort(int port) {
        Preconditions.checkArgument(port >= 0 && port <= 65535, "port out of range: %s", port);
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not a number: " + value, e);
        }
    }
}

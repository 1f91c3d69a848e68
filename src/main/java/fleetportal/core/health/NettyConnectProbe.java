package fleetportal.core.health;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * TCP handshake probe on a shared Netty event loop.
 * Connects are non-blocking, so any number of nodes can be probed at once
 * with a couple of threads.
 */
public final class NettyConnectProbe implements ConnectProbe, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NettyConnectProbe.class);

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    public NettyConnectProbe() {
        this(2);
    }

    public NettyConnectProbe(int threads) {
        AtomicInteger counter = new AtomicInteger();
        this.group = new NioEventLoopGroup(threads, r -> {
            Thread t = new Thread(r, "fleetportal-probe-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInboundHandlerAdapter());
    }

    @Override
    public CompletableFuture<Void> connect(String host, int port, Duration timeout) {
        CompletableFuture<Void> result = new CompletableFuture<>();

        bootstrap.clone()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.max(1, timeout.toMillis()))
                .connect(host, port)
                .addListener((ChannelFutureListener) future -> {
                    if (future.isSuccess()) {
                        future.channel().close();
                        result.complete(null);
                    } else {
                        result.completeExceptionally(future.cause());
                    }
                });

        return result;
    }

    @Override
    public void close() {
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        log.info("Probe event loop stopped");
    }
}

package dev.socks.server;

import dev.socks.server.config.PoolProperties;
import dev.socks.server.config.TransportProperties;
import dev.socks.server.fibo.FibonacciHandler;
import dev.socks.server.pool.WorkerPool;
import dev.socks.transport.Transport;
import dev.socks.transport.Transports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Demo server exposing the {@code fibo} command. Transport and pool size come from
 * {@code socks.transport.*} and {@code socks.pool.*}.
 */
@SpringBootApplication
@EnableConfigurationProperties({TransportProperties.class, PoolProperties.class})
public class FiboServerApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(FiboServerApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(FiboServerApplication.class, args);
    }

    @Bean(destroyMethod = "gracefulStop")
    @ConditionalOnExpression("${socks.pool.threads:4} > 0")
    WorkerPool workerPool(PoolProperties poolProperties) {
        return new WorkerPool(poolProperties.getThreads());
    }

    @Bean(initMethod = "startAsync", destroyMethod = "stop")
    Server fiboServer(TransportProperties transportProperties, ObjectProvider<WorkerPool> workerPool) {
        Transport transport = Transports.create(transportProperties.toSettings());
        LOGGER.info("Serving fibo over {}", transport);
        Server server = new Server(transport, workerPool.getIfAvailable());
        server.addHandler(FibonacciHandler.COMMAND, new FibonacciHandler());
        return server;
    }
}

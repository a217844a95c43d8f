package site.minikv;

import lombok.extern.slf4j.Slf4j;
import site.minikv.server.KvServer;
import site.minikv.server.MiniKvServer;
import site.minikv.server.config.KvServerConfig;

@Slf4j
public class MiniKvLauncher {
    public static void main(String[] args) {
        final KvServerConfig config = KvServerConfig.load(args);
        final KvServer server = new MiniKvServer(config);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("正在关闭服务器...");
            server.stop();
        }, "minikv-shutdown"));

        server.start();
    }
}

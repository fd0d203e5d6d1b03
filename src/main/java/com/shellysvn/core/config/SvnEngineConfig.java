package com.shellysvn.core.config;

import com.shellysvn.core.client.SvnClient;
import com.shellysvn.core.exec.ProcessSvnCommandRunner;
import com.shellysvn.core.exec.SvnCommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SvnEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(SvnEngineConfig.class);

    @Bean
    public SvnCommandRunner svnCommandRunner(ShellyProperties properties) {
        var context = properties.toExecutionContext();
        log.debug("svn executable: {}, proxy: {}, timeout: {}s, ssl verify: {}",
                properties.getExecutable(), context.proxy(),
                context.connectionTimeout().toSeconds(), context.sslVerify());
        return new ProcessSvnCommandRunner(properties.getExecutable(), context);
    }

    @Bean
    public SvnClient svnClient(SvnCommandRunner svnCommandRunner) {
        return new SvnClient(svnCommandRunner);
    }
}

package com.shipyard.scm;

import com.shipyard.config.ShipyardProperties;
import com.shipyard.core.collaborator.ChangeRequestHost;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ScmConfig {

    private static final Logger log = LoggerFactory.getLogger(ScmConfig.class);

    @Bean
    public ChangeRequestHost changeRequestHost(ShipyardProperties properties) {
        var scm = properties.getScm();
        if (!properties.isScmConfigured()) {
            log.info("shipyard.scm owner/repo/token not set; change-request reporting disabled");
            return new NoopChangeRequestHost();
        }
        return new GitHubChangeRequestHost(scm.getApiUrl(), scm.getOwner(), scm.getRepo(), scm.getToken());
    }
}

package com.truthfeed.anchor;

import com.truthfeed.config.TruthFeedProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
public class AnchoringConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AnchoringConfiguration.class);

    /**
     * Remote anchoring when {@code truth-feed.anchoring.endpoint} is set,
     * otherwise the local anchor ledger.
     */
    @Bean
    public AnchoringService anchoringService(TruthFeedProperties properties,
                                             RestTemplate outboundRestTemplate,
                                             Clock clock) {
        String endpoint = properties.anchoring().endpoint();
        if (endpoint != null && !endpoint.isBlank()) {
            log.info("Anchoring through remote endpoint {}", endpoint);
            return new HttpAnchoringService(outboundRestTemplate, endpoint);
        }
        log.info("No anchoring endpoint configured, using local anchor ledger");
        return new LocalAnchorLedger(clock);
    }
}

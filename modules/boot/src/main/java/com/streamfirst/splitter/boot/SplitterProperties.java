package com.streamfirst.splitter.boot;

import com.streamfirst.splitter.domain.SplitterEvent;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the splitter application, bound from the {@code splitter.*} keys.
 */
@Data
@ConfigurationProperties(prefix = "splitter")
public class SplitterProperties {

    /** Identity holding the owner capability at startup */
    private String owner;

    /** Topic notifications are published on */
    private String topic = SplitterEvent.DEFAULT_TOPIC;

    /** Payees registered by the owner at startup; leave empty to initialize later */
    private List<PayeeEntry> payees = new ArrayList<>();

    private Demo demo = new Demo();

    @Data
    public static class PayeeEntry {
        private String id;
        private long shares;
    }

    @Data
    public static class Demo {
        private boolean enabled;
        private String depositor = "treasury";
        private long depositAmount = 100;
    }
}

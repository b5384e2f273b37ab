package com.example.nl2cmd.config;

import com.example.nl2cmd.classifier.IntentClassifier;
import com.example.nl2cmd.classifier.TfIdfIntentClassifier;
import com.example.nl2cmd.dao.CommandDatasetDao;
import com.example.nl2cmd.model.OsFamily;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

@Slf4j
@Configuration
public class ResolverConfig {

    static final String AUTO = "auto";

    @Bean
    public OsFamily defaultOsFamily(Nl2CmdProperties properties) {
        String configured = properties.getOsFamily();
        OsFamily os = configured == null || configured.isBlank() || AUTO.equals(configured.trim().toLowerCase(Locale.ROOT))
                ? OsFamily.fromPlatform(System.getProperty("os.name"))
                : OsFamily.fromKey(configured);
        log.info("Default OS family: {}", os.key());
        return os;
    }

    @Bean
    @ConditionalOnProperty(prefix = "nl2cmd.classifier", name = "type", havingValue = "tfidf")
    public IntentClassifier tfIdfIntentClassifier(CommandDatasetDao datasetDao) {
        return new TfIdfIntentClassifier(datasetDao);
    }
}

package com.walletcustody.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "walletcustody.classifier")
@NoArgsConstructor
@Getter
@Setter
public class ClassifierProperties {

    /** Confirmations at which a looked-up transaction is stored as confirmed. */
    private long minConfirmations = 12;
}

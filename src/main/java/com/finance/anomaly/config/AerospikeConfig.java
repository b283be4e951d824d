package com.finance.anomaly.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

/**
 * Aerospike connection for the store-backed repository. The engine only reads, so no write
 * policy is exposed. Tests replace these beans with mocks (profile "test").
 */
@Configuration
@Profile("!test")
@ConditionalOnProperty(name = "detection.repository", havingValue = "aerospike", matchIfMissing = true)
public class AerospikeConfig {

    public static final String SET_DEALERS = "dealers";
    public static final String SET_SUBMISSIONS = "finance_submissions";
    public static final String SET_TEMPLATES = "template_structures";

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:finance}")
    private String namespace;

    @Bean(destroyMethod = "close")
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = 100;
        clientPolicy.timeout = 5000;

        clientPolicy.readPolicyDefault.totalTimeout = 3000;
        clientPolicy.readPolicyDefault.socketTimeout = 1000;

        // Snapshot loads scan whole sets; give them more room than point reads
        clientPolicy.scanPolicyDefault.totalTimeout = 30000;
        clientPolicy.scanPolicyDefault.socketTimeout = 10000;

        return new AerospikeClient(clientPolicy, host, port);
    }

    @Bean
    public Policy defaultReadPolicy() {
        Policy policy = new Policy();
        policy.totalTimeout = 3000;
        policy.socketTimeout = 1000;
        return policy;
    }

    @Bean
    public ScanPolicy defaultScanPolicy() {
        ScanPolicy policy = new ScanPolicy();
        policy.maxRecords = 0;
        policy.concurrentNodes = true;
        policy.totalTimeout = 30000;
        policy.socketTimeout = 10000;
        return policy;
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }
}

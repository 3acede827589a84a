package com.payroll.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payroll.taxengine.PayrollJson;
import com.payroll.taxengine.calc.PayrollTaxEngine;
import com.payroll.taxengine.config.TaxYearConfigRepository;
import com.payroll.taxengine.ledger.PayrollLedgerRow;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.Serdes;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.streams.KafkaStreams;
import org.apache.kafka.streams.StreamsConfig;
import org.apache.kafka.streams.Topology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.stream.Collectors;

public class LedgerProcessorApp {

    private static final Logger log = LoggerFactory.getLogger(LedgerProcessorApp.class);

    static final String RUNS_TOPIC = envOrDefault("PAYROLL_RUNS_TOPIC", "payroll-runs");
    static final String LEDGER_TOPIC = envOrDefault("PAYROLL_LEDGER_TOPIC", "payroll-ledger");
    static final String REJECTIONS_TOPIC = envOrDefault("PAYROLL_REJECTIONS_TOPIC", "payroll-rejections");

    static final String LEDGER_SINK = "ledger-sink";
    static final String REJECTION_SINK = "rejection-sink";

    static final LedgerHistory history = new LedgerHistory();

    public static void main(String[] args) {
        Properties props = buildConfig();
        String bootstrapServers = props.getProperty(StreamsConfig.BOOTSTRAP_SERVERS_CONFIG);

        // Year-to-date wages come from rows already on the ledger topic, so load them
        // before the first run is processed. Runs are not replayed: that would re-emit rows.
        prescanLedger(bootstrapServers);

        PayrollTaxEngine engine = new PayrollTaxEngine(TaxYearConfigRepository.fromEnvironment());
        Topology topology = buildTopology(engine, history);
        log.info("Topology:\n{}", topology.describe());

        KafkaStreams streams = new KafkaStreams(topology, props);
        streams.cleanUp();

        CountDownLatch latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            streams.close();
            latch.countDown();
        }));

        try {
            streams.start();
            log.info("Ledger Processor started ({} -> {} / {})", RUNS_TOPIC, LEDGER_TOPIC, REJECTIONS_TOPIC);
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static Topology buildTopology(PayrollTaxEngine engine, LedgerHistory history) {
        Topology topology = new Topology();

        topology.addSource("payroll-runs-source",
            Serdes.String().deserializer(), Serdes.String().deserializer(),
            RUNS_TOPIC);

        topology.addProcessor("ledger-processor",
            () -> new LedgerProcessor(engine, history),
            "payroll-runs-source");

        topology.addSink(LEDGER_SINK,
            LEDGER_TOPIC,
            Serdes.String().serializer(), Serdes.String().serializer(),
            "ledger-processor");

        topology.addSink(REJECTION_SINK,
            REJECTIONS_TOPIC,
            Serdes.String().serializer(), Serdes.String().serializer(),
            "ledger-processor");

        return topology;
    }

    /**
     * Reads the ledger topic from the beginning into {@link #history}. A tombstone removes
     * the row for its key.
     */
    private static void prescanLedger(String bootstrapServers) {
        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "ledger-prescan-" + System.currentTimeMillis());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());

        try (KafkaConsumer<String, String> consumer = new KafkaConsumer<>(props)) {
            List<TopicPartition> partitions = consumer.partitionsFor(LEDGER_TOPIC)
                .stream()
                .map(pi -> new TopicPartition(pi.topic(), pi.partition()))
                .collect(Collectors.toList());
            consumer.assign(partitions);
            consumer.seekToBeginning(partitions);

            Map<TopicPartition, Long> endOffsets = consumer.endOffsets(partitions);
            int scanned = 0, skipped = 0;

            while (!caughtUp(consumer, partitions, endOffsets)) {
                ConsumerRecords<String, String> records = consumer.poll(Duration.ofSeconds(5));
                for (ConsumerRecord<String, String> record : records) {
                    scanned++;
                    if (!applyLedgerRecord(history, record.key(), record.value())) {
                        skipped++;
                    }
                }
            }

            log.info("Ledger pre-scan complete: {} records scanned, {} skipped, {} rows in history",
                scanned, skipped, history.size());
        } catch (Exception e) {
            log.warn("Ledger pre-scan failed (year-to-date wages start from zero): {}", e.getMessage());
        }
    }

    private static boolean caughtUp(KafkaConsumer<String, String> consumer, List<TopicPartition> partitions,
                                    Map<TopicPartition, Long> endOffsets) {
        for (TopicPartition tp : partitions) {
            if (consumer.position(tp) < endOffsets.get(tp)) {
                return false;
            }
        }
        return true;
    }

    /** Applies one ledger-topic record to the history; returns false when it could not be read. */
    static boolean applyLedgerRecord(LedgerHistory history, String key, String value) {
        ObjectMapper mapper = PayrollJson.mapper();
        try {
            if (value == null) {
                if (key == null) return false;
                JsonNode keyNode = mapper.readTree(key);
                history.remove(PayrollLedgerRow.key(
                    keyNode.path("companyId").asText(),
                    keyNode.path("employeeId").asText(),
                    LocalDate.parse(keyNode.path("payDate").asText())));
                return true;
            }
            history.record(mapper.readValue(value, PayrollLedgerRow.class));
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Skipping unreadable ledger record {}: {}", key, e.getMessage());
            return false;
        }
    }

    private static Properties buildConfig() {
        Properties props = new Properties();
        props.put(StreamsConfig.APPLICATION_ID_CONFIG,
            envOrDefault("APPLICATION_ID", "payroll-ledger-processor"));
        props.put(StreamsConfig.BOOTSTRAP_SERVERS_CONFIG,
            envOrDefault("KAFKA_BOOTSTRAP_SERVERS", "localhost:29092"));
        props.put(StreamsConfig.DEFAULT_KEY_SERDE_CLASS_CONFIG,
            Serdes.StringSerde.class.getName());
        props.put(StreamsConfig.DEFAULT_VALUE_SERDE_CLASS_CONFIG,
            Serdes.StringSerde.class.getName());
        // Single thread: the shared history must see each employee's runs in order
        props.put(StreamsConfig.NUM_STREAM_THREADS_CONFIG, 1);
        props.put(StreamsConfig.COMMIT_INTERVAL_MS_CONFIG, 1000);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        return props;
    }

    static String envOrDefault(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}

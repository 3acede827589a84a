package com.payroll.reports;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Rebuilds the ledger snapshot from the start of the ledger topic, then republishes
 * company-quarter reports as new rows arrive. A broker failure restarts the cycle after
 * {@code REPORT_RESTART_DELAY_MS} with a fresh snapshot.
 */
public class ReportUpdaterApp {

    private static final Logger log = LoggerFactory.getLogger(ReportUpdaterApp.class);

    static final String LEDGER_TOPIC = envOrDefault("PAYROLL_LEDGER_TOPIC", "payroll-ledger");
    static final String REPORTS_TOPIC = envOrDefault("PAYROLL_REPORTS_TOPIC", "payroll-reports");

    private static volatile boolean shuttingDown = false;

    public static void main(String[] args) throws InterruptedException {
        String bootstrapServers = envOrDefault("KAFKA_BOOTSTRAP_SERVERS", "localhost:29092");
        String groupId = envOrDefault("APPLICATION_ID", "payroll-report-updater");
        long restartDelayMs = Long.parseLong(envOrDefault("REPORT_RESTART_DELAY_MS", "30000"));

        Runtime.getRuntime().addShutdownHook(new Thread(() -> shuttingDown = true));

        while (!shuttingDown) {
            ReportUpdater updater = new ReportUpdater(new LedgerSnapshot(), new ReportBuilder(), REPORTS_TOPIC);
            try {
                loadSnapshot(updater, bootstrapServers);
                publishLoop(updater, bootstrapServers, groupId);
            } catch (RuntimeException e) {
                log.error("Report Updater failed, restarting in {} ms: {}", restartDelayMs, e.getMessage(), e);
                Thread.sleep(restartDelayMs);
            }
        }
        log.info("Report Updater exited");
    }

    private static void publishLoop(ReportUpdater updater, String bootstrapServers, String groupId) {
        Properties consumerProps = consumerProps(bootstrapServers, groupId);
        consumerProps.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");

        Properties producerProps = new Properties();
        producerProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());

        try (KafkaConsumer<String, String> consumer = new KafkaConsumer<>(consumerProps);
             KafkaProducer<String, String> producer = new KafkaProducer<>(producerProps)) {
            consumer.subscribe(Collections.singletonList(LEDGER_TOPIC));
            log.info("Report Updater started: {} -> {}", LEDGER_TOPIC, REPORTS_TOPIC);

            while (!shuttingDown) {
                ConsumerRecords<String, String> records = consumer.poll(Duration.ofSeconds(1));
                for (ConsumerRecord<String, String> record : records) {
                    try {
                        for (ProducerRecord<String, String> report : updater.onLedgerRecord(record.key(), record.value())) {
                            producer.send(report);
                        }
                    } catch (Exception e) {
                        log.error("Skipping ledger record {}: {}", record.key(), e.getMessage(), e);
                    }
                }
                if (!records.isEmpty()) {
                    producer.flush();
                }
            }
        }
    }

    /** Reads every ledger record up to the current end offsets without publishing. */
    private static void loadSnapshot(ReportUpdater updater, String bootstrapServers) {
        Properties props = consumerProps(bootstrapServers, "report-updater-prescan-" + System.currentTimeMillis());
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");

        try (KafkaConsumer<String, String> consumer = new KafkaConsumer<>(props)) {
            List<TopicPartition> partitions = consumer.partitionsFor(LEDGER_TOPIC).stream()
                .map(pi -> new TopicPartition(pi.topic(), pi.partition()))
                .collect(Collectors.toList());
            consumer.assign(partitions);
            consumer.seekToBeginning(partitions);
            Map<TopicPartition, Long> endOffsets = consumer.endOffsets(partitions);

            int skipped = 0;
            while (partitions.stream().anyMatch(tp -> consumer.position(tp) < endOffsets.get(tp))) {
                for (ConsumerRecord<String, String> record : consumer.poll(Duration.ofSeconds(5))) {
                    try {
                        updater.load(record.key(), record.value());
                    } catch (Exception e) {
                        skipped++;
                        log.warn("Unreadable ledger record {}: {}", record.key(), e.getMessage());
                    }
                }
            }
            log.info("Ledger snapshot loaded: {} rows, {} records skipped", updater.getSnapshot().size(), skipped);
        }
    }

    private static Properties consumerProps(String bootstrapServers, String groupId) {
        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        return props;
    }

    private static String envOrDefault(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}

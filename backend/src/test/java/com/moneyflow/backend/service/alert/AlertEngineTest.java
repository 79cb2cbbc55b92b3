package com.moneyflow.backend.service.alert;

import com.moneyflow.backend.config.AlertProperties;
import com.moneyflow.backend.config.SignalProperties;
import com.moneyflow.backend.exception.NotificationException;
import com.moneyflow.backend.model.Alert;
import com.moneyflow.backend.model.AlertSeverity;
import com.moneyflow.backend.model.MarketState;
import com.moneyflow.backend.model.Signal;
import com.moneyflow.backend.model.SignalSeverity;
import com.moneyflow.backend.service.MetricsService;
import com.moneyflow.backend.service.notify.NotificationChannel;
import com.moneyflow.backend.service.signal.ScenarioRules;
import com.moneyflow.backend.service.signal.SignalGenerator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class AlertEngineTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-08-05T14:00:00Z"), ZoneOffset.UTC);

    private AlertProperties properties;
    private ThreadPoolTaskExecutor executor;
    private AlertEngine engine;
    private RecordingChannel chat;
    private RecordingChannel email;
    private RecordingChannel dashboard;

    @BeforeEach
    void setUp() {
        properties = new AlertProperties();
        properties.getRateLimiting().setEnabled(false);
        properties.setSendTimeout(Duration.ofSeconds(2));
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setThreadNamePrefix("alert-test-");
        executor.initialize();
        engine = newEngine();
        chat = new RecordingChannel("chat");
        email = new RecordingChannel("email");
        dashboard = new RecordingChannel("dashboard");
        engine.registerNotifier("chat", chat);
        engine.registerNotifier("email", email);
        engine.registerNotifier("dashboard", dashboard);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void infoSignalsNeverBecomeAlerts() {
        List<Alert> alerts = engine.evaluateAlerts(List.of(signal("quiet", SignalSeverity.INFO, 0.5)));

        assertThat(alerts).isEmpty();
        assertThat(engine.getRecentAlerts(10)).isEmpty();
        assertThat(chat.received).isEmpty();
    }

    @Test
    void warningGoesToChatOnly() {
        engine.evaluateAlerts(List.of(signal("volatility_spike", SignalSeverity.WARNING, 0.8)));

        assertThat(chat.received).hasSize(1);
        assertThat(email.received).isEmpty();
        assertThat(dashboard.received).isEmpty();
    }

    @Test
    void criticalGoesToChatAndEmail() {
        List<Alert> alerts = engine.evaluateAlerts(List.of(signal("risk_off_transition", SignalSeverity.CRITICAL, 0.75)));

        assertThat(alerts).extracting(Alert::getSeverity).containsExactly(AlertSeverity.CRITICAL);
        assertThat(chat.received).hasSize(1);
        assertThat(email.received).hasSize(1);
        assertThat(dashboard.received).isEmpty();
    }

    @Test
    void emergencyReachesEveryChannelIncludingLateRegistrations() {
        RecordingChannel pager = new RecordingChannel("pager");
        engine.registerNotifier("pager", pager);

        engine.evaluateAlerts(List.of(signal("liquidity_crisis", SignalSeverity.EMERGENCY, 0.5)));

        assertThat(List.of(chat, email, dashboard, pager)).allSatisfy(channel -> assertThat(channel.received).hasSize(1));
    }

    @Test
    void unregisteredChannelIsSkipped() {
        engine.unregisterNotifier("email");

        engine.evaluateAlerts(List.of(signal("risk_off_transition", SignalSeverity.CRITICAL, 0.75)));

        assertThat(engine.getRegisteredChannels()).containsExactly("chat", "dashboard");
        assertThat(chat.received).hasSize(1);
        assertThat(email.received).isEmpty();
    }

    @Test
    void highConfidenceEscalatesOneLevel() {
        List<Alert> alerts = engine.evaluateAlerts(List.of(
                signal("korea_capital_outflow", SignalSeverity.WARNING, 0.95),
                signal("liquidity_crisis", SignalSeverity.EMERGENCY, 1.0)));

        assertThat(alerts).extracting(Alert::getSeverity)
                .containsExactly(AlertSeverity.CRITICAL, AlertSeverity.EMERGENCY);
        assertThat(email.received).hasSize(2);
    }

    @Test
    void alertKeepsSignalContentAndFormatsMessage() {
        Signal signal = Signal.builder()
                .scenario("risk_off_transition")
                .severity(SignalSeverity.CRITICAL)
                .confidence(0.75)
                .triggers(List.of("VIX spike: 35.0", "Heavy TLT inflow: +1,000"))
                .recommendation("Cut equity exposure.")
                .timestamp(clock.instant())
                .metadata(Map.of("conditions_met", 3))
                .build();

        Alert alert = engine.evaluateAlerts(List.of(signal)).get(0);

        assertThat(alert.getId()).isNotBlank();
        assertThat(alert.getTimestamp()).isEqualTo("2024-08-05T14:00Z");
        assertThat(alert.getTriggers()).containsExactly("VIX spike: 35.0", "Heavy TLT inflow: +1,000");
        assertThat(alert.getRecommendation()).isEqualTo("Cut equity exposure.");
        assertThat(alert.getMetadata()).containsEntry("conditions_met", 3);
        assertThat(alert.getMessage()).isEqualTo("[CRITICAL] Risk Off Transition\n\n"
                + "Confidence: 75.0%\n\n"
                + "Triggers:\n"
                + "• VIX spike: 35.0\n"
                + "• Heavy TLT inflow: +1,000\n"
                + "\nRecommendation:\nCut equity exposure.");
        assertThat(chat.received.get(0)).isSameAs(alert);
    }

    @Test
    void failingChannelDoesNotBlockOthers() {
        engine.registerNotifier("email", new FailingChannel("email"));
        Alert alert = engine.evaluateAlerts(List.of(signal("liquidity_crisis", SignalSeverity.EMERGENCY, 0.5))).get(0);

        DispatchReport report = engine.dispatch(alert);

        assertThat(report.results())
                .containsEntry("chat", DeliveryStatus.DELIVERED)
                .containsEntry("email", DeliveryStatus.FAILED)
                .containsEntry("dashboard", DeliveryStatus.DELIVERED);
        assertThat(engine.getRecentAlerts(10)).containsExactly(alert);
    }

    @Test
    void slowChannelTimesOut() {
        properties.setSendTimeout(Duration.ofMillis(100));
        AlertEngine fast = newEngine();
        CountDownLatch release = new CountDownLatch(1);
        fast.registerNotifier("chat", new BlockingChannel("chat", release));
        fast.registerNotifier("dashboard", dashboard);
        try {
            Alert alert = fast.evaluateAlerts(List.of(signal("liquidity_crisis", SignalSeverity.EMERGENCY, 0.5))).get(0);
            DispatchReport report = fast.dispatch(alert);

            assertThat(report.results())
                    .containsEntry("chat", DeliveryStatus.TIMED_OUT)
                    .containsEntry("dashboard", DeliveryStatus.DELIVERED);
            assertThat(report.allDelivered()).isFalse();
        } finally {
            release.countDown();
        }
    }

    @Test
    void stuckChannelDoesNotHoldBackOtherChannelsAcrossABatch() {
        AlertEngine isolated = newEngine();
        CountDownLatch release = new CountDownLatch(1);
        List<Long> emailMillis = new CopyOnWriteArrayList<>();
        long start = System.nanoTime();
        isolated.registerNotifier("chat", new BlockingChannel("chat", release));
        isolated.registerNotifier("email", new TimedChannel("email", start, emailMillis));
        try {
            List<Alert> alerts = isolated.evaluateAlerts(List.of(
                    signal("risk_off_transition", SignalSeverity.CRITICAL, 0.75),
                    signal("korea_capital_outflow", SignalSeverity.CRITICAL, 0.75),
                    signal("liquidity_crisis", SignalSeverity.CRITICAL, 0.75)));
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertThat(alerts).hasSize(3);
            assertThat(emailMillis).hasSize(3).allSatisfy(millis -> assertThat(millis).isLessThan(1000L));
            // the chat timeouts overlap instead of adding up
            assertThat(elapsedMillis).isLessThan(4000L);
        } finally {
            release.countDown();
        }
    }

    @Test
    void fullRiskOffSnapshotEscalatesToEmergencyOnEveryChannel() {
        SignalGenerator generator = new SignalGenerator(new ScenarioRules(new SignalProperties()),
                new MetricsService(new SimpleMeterRegistry()), clock);
        MarketState state = MarketState.of(Map.of(
                "vix", 32,
                "tlt_flow", 1_000_000,
                "hyg_spread", 6.0,
                "gold_change", 1.5,
                "dxy_change", 0.8));

        List<Signal> signals = generator.generateSignals(state);
        List<Alert> alerts = engine.evaluateAlerts(signals);

        assertThat(signals).singleElement().satisfies(signal -> {
            assertThat(signal.getScenario()).isEqualTo(ScenarioRules.RISK_OFF_TRANSITION);
            assertThat(signal.getSeverity()).isEqualTo(SignalSeverity.CRITICAL);
            assertThat(signal.getConfidence()).isEqualTo(1.0);
            assertThat(signal.getTriggers()).hasSize(4);
        });
        assertThat(alerts).singleElement().satisfies(alert -> {
            assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.EMERGENCY);
            assertThat(alert.getConfidence()).isEqualTo(1.0);
        });
        assertThat(List.of(chat, email, dashboard)).allSatisfy(channel ->
                assertThat(channel.received).containsExactlyElementsOf(alerts));
    }

    @Test
    void historyIsBoundedAndOrdered() {
        properties.setHistorySize(3);
        AlertEngine bounded = newEngine();
        for (int i = 0; i < 5; i++) {
            bounded.evaluateAlerts(List.of(signal("scenario_" + i, SignalSeverity.WARNING, 0.5)));
        }

        assertThat(bounded.getRecentAlerts(10)).extracting(Alert::getScenario)
                .containsExactly("scenario_2", "scenario_3", "scenario_4");
        assertThat(bounded.getRecentAlerts(2)).extracting(Alert::getScenario)
                .containsExactly("scenario_3", "scenario_4");

        bounded.clearHistory();
        assertThat(bounded.getRecentAlerts(10)).isEmpty();
    }

    @Test
    void listenersSeeAlertsAndTheirFailuresAreContained() {
        List<Alert> seen = new CopyOnWriteArrayList<>();
        engine.addListener(alert -> {
            throw new IllegalStateException("store down");
        });
        engine.addListener(seen::add);

        List<Alert> alerts = engine.evaluateAlerts(List.of(signal("volatility_spike", SignalSeverity.WARNING, 0.8)));

        assertThat(seen).containsExactlyElementsOf(alerts);
        assertThat(chat.received).hasSize(1);
    }

    @Test
    void rateLimitedAlertsAreDroppedEntirely() {
        properties.getRateLimiting().setEnabled(true);
        AlertEngine limited = newEngine();
        limited.registerNotifier("chat", chat);

        limited.evaluateAlerts(List.of(signal("volatility_spike", SignalSeverity.WARNING, 0.8)));
        List<Alert> second = limited.evaluateAlerts(List.of(signal("volatility_spike", SignalSeverity.WARNING, 0.8)));

        assertThat(second).isEmpty();
        assertThat(limited.getRecentAlerts(10)).hasSize(1);
        assertThat(chat.received).hasSize(1);
    }

    private AlertEngine newEngine() {
        return new AlertEngine(properties, new AlertRateLimiter(properties, clock),
                new MetricsService(new SimpleMeterRegistry()), executor, clock);
    }

    private Signal signal(String scenario, SignalSeverity severity, double confidence) {
        return Signal.builder()
                .scenario(scenario)
                .severity(severity)
                .confidence(confidence)
                .triggers(List.of("trigger"))
                .recommendation("act")
                .timestamp(clock.instant())
                .metadata(Map.of())
                .build();
    }

    private static final class RecordingChannel implements NotificationChannel {

        private final String name;
        private final List<Alert> received = new CopyOnWriteArrayList<>();

        private RecordingChannel(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public void send(Alert alert) {
            received.add(alert);
        }
    }

    private record BlockingChannel(String name, CountDownLatch release) implements NotificationChannel {

        @Override
        public void send(Alert alert) {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private record TimedChannel(String name, long start, List<Long> sentAtMillis) implements NotificationChannel {

        @Override
        public void send(Alert alert) {
            sentAtMillis.add(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        }
    }

    private record FailingChannel(String name) implements NotificationChannel {

        @Override
        public void send(Alert alert) {
            throw new NotificationException(name, "boom");
        }
    }
}

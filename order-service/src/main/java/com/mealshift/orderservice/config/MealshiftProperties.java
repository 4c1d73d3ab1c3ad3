package com.mealshift.orderservice.config;

import com.mealshift.orderservice.model.CutoffMode;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.DayOfWeek;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Engine settings bound from the {@code mealshift.*} namespace.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "mealshift")
public class MealshiftProperties {

    private final ClockSettings clock = new ClockSettings();
    private final SweepSettings sweep = new SweepSettings();
    private final FanoutSettings fanout = new FanoutSettings();
    private final PolicyDefaults policy = new PolicyDefaults();
    private final SecuritySettings security = new SecuritySettings();

    @Getter
    @Setter
    public static class ClockSettings {
        // business time zone for dates and shift times
        private String zone = "Asia/Jakarta";
        private boolean referenceEnabled = false;
        private String referenceUrl = "https://worldtimeapi.org/api/timezone/Etc/UTC";
        private Duration syncInterval = Duration.ofHours(1);
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Getter
    @Setter
    public static class SweepSettings {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(5);
    }

    @Getter
    @Setter
    public static class FanoutSettings {
        private Duration heartbeatInterval = Duration.ofSeconds(15);
        private Duration emitterTimeout = Duration.ofMinutes(30);
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 500;
    }

    /**
     * Used until an administrator stores a policy.
     */
    @Getter
    @Setter
    public static class PolicyDefaults {
        private CutoffMode cutoffMode = CutoffMode.PER_SHIFT;
        private int cutoffDays = 0;
        private int cutoffLeadHours = 6;
        private DayOfWeek weeklyCutoffDay = DayOfWeek.FRIDAY;
        private int weeklyCutoffHour = 17;
        private int weeklyCutoffMinute = 0;
        private Set<DayOfWeek> orderableDays = EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.SATURDAY);
        private int maxWeeksAhead = 1;
        private int strikeThreshold = 3;
        private int restrictionDurationDays = 7;
        private int bookingHorizonDays = 7;
        private boolean lateCancellationAllowed = false;
        private int earlyCollectionMinutes = 30;
        private int collectionGraceMinutes = 0;
        private Duration reloadInterval = Duration.ofSeconds(60);
    }

    @Getter
    @Setter
    public static class SecuritySettings {
        // client whose roles are read from resource_access.<clientId>.roles
        private String clientId = "mealshift-backend";
    }
}

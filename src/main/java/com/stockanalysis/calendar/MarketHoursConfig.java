package com.stockanalysis.calendar;

import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * NSE session hours and holidays, bound from {@code analysis.market.*}.
 *
 * <p>The holiday list is maintained by hand from the exchange's published calendar.
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "analysis.market")
public class MarketHoursConfig {

    @NotNull
    private String timezone = "Asia/Kolkata";

    @NotNull
    private LocalTime open = LocalTime.of(9, 15);

    @NotNull
    private LocalTime close = LocalTime.of(15, 30);

    private List<Holiday> holidays = new ArrayList<>();

    @Data
    public static class Holiday {

        private LocalDate date;
        private String name;
    }
}

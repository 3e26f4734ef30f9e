package com.company.footprint.service;

import com.company.footprint.config.FootprintProperties;
import com.company.footprint.domain.UsageReportRow;
import com.company.footprint.domain.UserProfile;
import com.company.footprint.domain.UserUsage;
import com.company.footprint.dto.response.Co2eSeriesResponse;
import com.company.footprint.repository.UsageRepository;
import com.company.footprint.service.UsageViewService.Co2eUnit;
import com.company.footprint.service.UsageViewService.Period;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UsageViewServiceTest {

    private static final LocalDate DAY_1 = LocalDate.of(2023, 6, 1);
    private static final LocalDate DAY_2 = LocalDate.of(2023, 6, 2);

    @Mock
    private UsageRepository usageRepository;

    private UsageViewService service;

    @BeforeEach
    void setUp() {
        service = new UsageViewService(usageRepository, new FootprintProperties());
    }

    private static UsageReportRow row(LocalDate day, Object... loginsAndGrams) {
        UsageReportRow row = UsageReportRow.builder().intervalStart(day.atTime(10, 15)).build();
        for (int i = 0; i < loginsAndGrams.length; i += 2) {
            UserUsage usage = new UserUsage();
            usage.setCo2e(((Number) loginsAndGrams[i + 1]).doubleValue());
            row.getUsers().put((String) loginsAndGrams[i], usage);
        }
        return row;
    }

    private static UserProfile user(String login, String... teams) {
        return UserProfile.builder().login(login).teams(List.of(teams)).build();
    }

    private void givenUsage() {
        when(usageRepository.findUsers()).thenReturn(Map.of(
                "alice", user("alice", "A"),
                "bob", user("bob", "B"),
                "carol", user("carol", "A", "B"),
                "dave", user("dave", "C")));
        when(usageRepository.findIntervalRows(any(LocalDateTime.class), any(LocalDateTime.class))).thenReturn(List.of(
                row(DAY_1, "alice", 1000, "bob", 500, "dave", 50),
                row(DAY_2, "alice", 2000, "carol", 100)));
    }

    @Test
    void organisationSeriesPerDay() {
        givenUsage();

        Co2eSeriesResponse response = service.getCo2eSeries(DAY_1, DAY_1.plusDays(2), Period.DAY, false,
                null, 0, Co2eUnit.G);

        assertThat(response.getSeries()).containsExactly("EMBL-EBI");
        assertThat(response.getPoints()).extracting(Co2eSeriesResponse.Point::getPeriod).containsExactly(DAY_1, DAY_2);
        assertThat(response.getPoints().get(0).getValues()).containsEntry("EMBL-EBI", 1550.0);
        assertThat(response.getPoints().get(1).getValues()).containsEntry("EMBL-EBI", 2100.0);
    }

    @Test
    void smallestTeamsAreFoldedIntoOthers() {
        givenUsage();

        Co2eSeriesResponse response = service.getCo2eSeries(DAY_1, DAY_1.plusDays(2), Period.DAY, true,
                null, 2, Co2eUnit.G);

        assertThat(response.getGroupBy()).isEqualTo("team");
        assertThat(response.getSeries()).containsExactly("A", Co2eSeriesResponse.OTHERS);
        assertThat(response.getPoints().get(0).getValues())
                .containsEntry("A", 1000.0)
                .containsEntry(Co2eSeriesResponse.OTHERS, 550.0);
        assertThat(response.getPoints().get(1).getValues())
                .containsEntry("A", 2100.0)
                .containsEntry(Co2eSeriesResponse.OTHERS, 100.0);
    }

    @Test
    void userFilterAndEmptyPeriods() {
        givenUsage();

        Co2eSeriesResponse response = service.getCo2eSeries(DAY_1, DAY_1.plusDays(3), Period.DAY, false,
                List.of("bob"), 0, Co2eUnit.G);

        assertThat(response.getPoints()).hasSize(3);
        assertThat(response.getPoints()).extracting(p -> p.getValues().get("EMBL-EBI"))
                .containsExactly(500.0, 0.0, 0.0);
    }

    @Test
    void weeksStartOnMonday() {
        givenUsage();

        Co2eSeriesResponse response = service.getCo2eSeries(DAY_1, DAY_1.plusDays(7), Period.WEEK, false,
                null, 0, Co2eUnit.KG);

        assertThat(response.getUnit()).isEqualTo("kg");
        assertThat(response.getPoints()).extracting(Co2eSeriesResponse.Point::getPeriod)
                .containsExactly(LocalDate.of(2023, 5, 29), LocalDate.of(2023, 6, 5));
        assertThat(response.getPoints().get(0).getValues()).containsEntry("EMBL-EBI", 4.0);
    }

    @Test
    void emptyStoreGivesNoPoints() {
        Co2eSeriesResponse response = service.getCo2eSeries(null, null, Period.MONTH, false,
                null, 0, Co2eUnit.KG);

        assertThat(response.getPoints()).isEmpty();
        assertThat(response.getSeries()).isEmpty();
    }

    @Test
    void unitsRoundHalfEven() {
        assertThat(Co2eUnit.T.convert(1_234_567)).isEqualTo(1.235);
        assertThat(Co2eUnit.KG.convert(2_500)).isEqualTo(2.0);
        assertThat(Co2eUnit.G.convert(12.5)).isEqualTo(12.0);
        assertThat(Co2eUnit.fromString(null)).isEqualTo(Co2eUnit.KG);
    }

    @Test
    void unknownPeriodIsRejected() {
        assertThat(Period.fromString("Month")).isEqualTo(Period.MONTH);
        assertThatThrownBy(() -> Period.fromString("fortnight"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

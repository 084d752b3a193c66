package com.example.fundlens.marketdata;

import com.example.fundlens.domain.DateRange;
import com.example.fundlens.util.TestSeriesFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class YahooChartClientTest {
    private static final DateRange RANGE = new DateRange(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 8));

    private static final String CHART = """
            {"chart":{"result":[{
              "meta":{"symbol":"PRHSX","currency":"USD","exchangeTimezoneName":"America/New_York"},
              "timestamp":[1709562600,1709649000,1709735400],
              "events":{
                "dividends":{"1709649000":{"amount":0.42,"date":1709649000}},
                "capitalGains":{"1709649000":{"amount":1.10,"date":1709649000}}
              },
              "indicators":{
                "quote":[{"close":[100.0,null,98.5]}],
                "adjclose":[{"adjclose":[95.0,null,94.0]}]
              }
            }],"error":null}}
            """;

    private MockRestServiceServer server;
    private YahooChartClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new YahooChartClient(builder, TestSeriesFactory.unthrottled());
    }

    @Test
    void parsesClosesAdjustedClosesAndEvents() {
        server.expect(requestTo(startsWith("https://query1.finance.yahoo.com/v8/finance/chart/PRHSX?period1=")))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(CHART, MediaType.APPLICATION_JSON));

        Optional<RawHistory> history = client.fetchDaily("PRHSX", RANGE);

        server.verify();
        assertThat(history).isPresent();
        // The null close on 2024-03-05 drops that bar together with its events
        assertThat(history.get().getBars()).extracting(RawBar::date)
                .containsExactly(LocalDate.of(2024, 3, 4), LocalDate.of(2024, 3, 6));
        assertThat(history.get().getBars().get(0).adjClose()).isEqualTo(95.0);
        assertThat(history.get().hasAdjustedClose()).isTrue();
    }

    @Test
    void attachesDistributionsToTheirTradingDay() throws Exception {
        Map<?, ?> body = new ObjectMapper().readValue(CHART.replace("[100.0,null,98.5]", "[100.0,99.0,98.5]"), Map.class);

        RawHistory history = YahooChartClient.parse(body);

        RawBar exDay = history.getBars().get(1);
        assertThat(exDay.date()).isEqualTo(LocalDate.of(2024, 3, 5));
        assertThat(exDay.dividend()).isEqualTo(0.42);
        assertThat(exDay.capitalGain()).isEqualTo(1.10);
        assertThat(exDay.adjClose()).isNull();
        assertThat(history.hasAdjustedClose()).isFalse();
    }

    @Test
    void unknownSymbolYieldsEmpty() {
        server.expect(requestTo(startsWith("https://query1.finance.yahoo.com/v8/finance/chart/NOPE")))
                .andRespond(withStatus(HttpStatus.NOT_FOUND)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"chart\":{\"result\":null,\"error\":{\"code\":\"Not Found\"}}}"));

        assertThat(client.fetchDaily("NOPE", RANGE)).isEmpty();
        server.verify();
    }
}

package com.portfolio.projection;

import com.portfolio.projection.domain.repository.SimulationRunRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class PortfolioProjectionApplicationTest {

    private static final String FLAT_PORTFOLIO = """
            {
              "asset_classes": [
                {"name": "Cash", "median_return": 0.0, "std_deviation": 0.0,
                 "min_return": -1.0, "max_return": 1.0, "allocation": 1.0}
              ],
              "initial_investment": 1000000,
              "time_horizon": 3,
              "num_simulations": 5000,
              "enable_drawdown": false
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private SimulationRunRepository repository;

    @Test
    @DisplayName("a flat portfolio runs end to end and lands in the history")
    void simulateAndStore() throws Exception {
        long before = repository.count();

        mockMvc.perform(post("/api/simulate").contentType(MediaType.APPLICATION_JSON).content(FLAT_PORTFOLIO))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_paths").value(5000))
                .andExpect(jsonPath("$.simulation_paths.length()").value(100))
                .andExpect(jsonPath("$.statistics.median.final_value").value(1_000_000.0))
                .andExpect(jsonPath("$.statistics.probability_of_maintaining").value(1.0))
                .andExpect(jsonPath("$.statistics.probability_of_depletion").value(0.0))
                .andExpect(jsonPath("$.seed").value(42));

        long deadline = System.currentTimeMillis() + 5_000;
        while (repository.count() == before && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertThat(repository.count()).isEqualTo(before + 1);

        mockMvc.perform(get("/api/simulations"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].median_final_value").value(1_000_000.0))
                .andExpect(jsonPath("$.items[0].account_type").value("TAX_FREE"));
    }

    @Test
    @DisplayName("too few simulations is rejected with 400")
    void rejectsSmallBatch() throws Exception {
        mockMvc.perform(post("/api/simulate").contentType(MediaType.APPLICATION_JSON)
                        .content(FLAT_PORTFOLIO.replace("5000", "1000")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("TOO_FEW_SIMULATIONS"));
    }
}

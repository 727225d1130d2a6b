package com.poolhistory.api;

import com.poolhistory.model.PoolDimensionVersion;
import com.poolhistory.service.DimensionStoreService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Optional;

import static com.poolhistory.support.PoolFixtures.d;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class DimensionControllerTest {

    @Mock
    private DimensionStoreService store;

    private MockMvc mvc;

    @BeforeEach
    void setup() {
        mvc = MockMvcBuilders.standaloneSetup(new DimensionController(store)).build();
    }

    @Test
    void listsHistory() throws Exception {
        when(store.history("p1")).thenReturn(List.of(
                PoolDimensionVersion.builder().poolId("p1").symbol("A").validFrom(d("2024-01-01")).validTo(d("2024-06-01")).build(),
                PoolDimensionVersion.builder().poolId("p1").symbol("B").validFrom(d("2024-06-01"))
                        .validTo(PoolDimensionVersion.OPEN_END).current(true).build()));

        mvc.perform(get("/api/v1/dimensions/p1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[1].symbol").value("B"));
    }

    @Test
    void asOfReturnsTheCoveringVersion() throws Exception {
        when(store.asOf("p1", d("2024-05-31"))).thenReturn(Optional.of(
                PoolDimensionVersion.builder().poolId("p1").symbol("A").build()));

        mvc.perform(get("/api/v1/dimensions/p1/as-of").param("date", "2024-05-31"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.symbol").value("A"));
    }

    @Test
    void asOfBeforeFirstVersionIsNotFound() throws Exception {
        when(store.asOf("p1", d("2023-12-31"))).thenReturn(Optional.empty());

        mvc.perform(get("/api/v1/dimensions/p1/as-of").param("date", "2023-12-31"))
                .andExpect(status().isNotFound());
    }
}

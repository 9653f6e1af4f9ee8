package surfacetexture.compute;

import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import surfacetexture.config.SurfaceConfig;

import static org.hamcrest.Matchers.closeTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Flujo completo sobre el contexto real: descomponer, consultar la sección y la serie de métricas.
 */
@SpringBootTest
@AutoConfigureMockMvc
public class SurfaceEngineApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private SurfaceConfig defaultConfig;

    @Test
    void testDefaultConfigurationFromApplicationYml() {
        assertEquals(80.0, defaultConfig.cutoff());
        assertEquals(643.0, defaultConfig.sampleWidth());
    }

    @Test
    void testDecomposeThenQuerySection() throws Exception {
        StringBuilder samples = new StringBuilder();
        for (int i = 0; i < 64; i++) {
            samples.append(i == 0 ? "" : ",").append(5);
        }

        String response = mockMvc.perform(post("/v1/surfaces")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"samples\": [" + samples + "], \"cutoff\": 80.0, \"sampleWidth\": 100.0}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dimension").value(8))
                .andReturn().getResponse().getContentAsString();
        String id = JsonPath.read(response, "$.id");

        mockMvc.perform(get("/v1/surfaces/" + id + "/sections/7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.positions[7]").value(100.0))
                .andExpect(jsonPath("$.waviness[0]", closeTo(5.0, 1e-9)));

        mockMvc.perform(get("/v1/surfaces/" + id + "/metrics/Wa"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.average", closeTo(5.0, 1e-9)));

        mockMvc.perform(get("/v1/surfaces/" + id + "/sections/8"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(delete("/v1/surfaces/" + id))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/v1/surfaces/" + id + "/sections/0"))
                .andExpect(status().isNotFound());
    }

    @Test
    void testUnreachableCutoffReturns422() throws Exception {
        mockMvc.perform(post("/v1/surfaces")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"samples\": [1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15, 16],"
                                + " \"cutoff\": 100.0, \"sampleWidth\": 100.0}"))
                .andExpect(status().isUnprocessableEntity());
    }
}

package io.tabdeck.board.app;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tabdeck.board.domain.Tab;
import io.tabdeck.board.domain.TabCatalog;
import io.tabdeck.status.restart.WorkloadRef;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class ConfigControllerTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        TabCatalog catalog = new TabCatalog(List.of(
            new Tab(0, "Zigbee2MQTT", "/z2m.svg", "https://z2m", "#FFC135", new WorkloadRef("home", "z2m")),
            new Tab(1, "Docs", "/docs.svg", "https://docs", null, null)));
        mvc = MockMvcBuilders.standaloneSetup(new ConfigController(catalog))
            .setMessageConverters(new MappingJackson2HttpMessageConverter(mapper))
            .build();
    }

    @Test
    void listsTabsWithRestartability() throws Exception {
        MvcResult result = mvc.perform(get("/api/config"))
            .andExpect(status().isOk())
            .andReturn();

        JsonNode tabs = mapper.readTree(result.getResponse().getContentAsString()).path("tabs");
        assertThat(tabs).hasSize(2);
        assertThat(tabs.get(0).path("text").asText()).isEqualTo("Zigbee2MQTT");
        assertThat(tabs.get(0).path("iconUrl").asText()).isEqualTo("/z2m.svg");
        assertThat(tabs.get(0).path("iframeUrl").asText()).isEqualTo("https://z2m");
        assertThat(tabs.get(0).path("restartable").asBoolean()).isTrue();
        assertThat(tabs.get(0).path("tabColor").asText()).isEqualTo("#FFC135");
        assertThat(tabs.get(1).path("restartable").asBoolean()).isFalse();
        assertThat(tabs.get(1).get("tabColor").isNull()).isTrue();
    }
}

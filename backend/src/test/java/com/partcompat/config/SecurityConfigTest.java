package com.partcompat.config;

import com.partcompat.IntegrationTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Route protection with authentication switched on.
 */
@AutoConfigureMockMvc
@TestPropertySource(properties = {
    "security.auth.enabled=true",
    "cors.allowed-origins=https://parts.example.com"
})
class SecurityConfigTest extends IntegrationTestSupport {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void organizationRoutes_areServed() throws Exception {
        mockMvc.perform(get("/api/organizations/{org}/alternate-groups/{groupId}", ORG, "grp-missing"))
            .andExpect(status().isNotFound());
    }

    @Test
    void routesOutsideOrganizations_areRefused() throws Exception {
        mockMvc.perform(get("/api/alternate-groups"))
            .andExpect(status().isForbidden());
        mockMvc.perform(get("/h2-console"))
            .andExpect(status().isForbidden());
    }

    @Test
    void corsPreflight_allowsConfiguredOriginOnly() throws Exception {
        mockMvc.perform(options("/api/organizations/{org}/alternate-groups/{groupId}", ORG, "grp-1")
                .header("Origin", "https://parts.example.com")
                .header("Access-Control-Request-Method", "PATCH"))
            .andExpect(status().isOk())
            .andExpect(header().string("Access-Control-Allow-Origin", "https://parts.example.com"));

        mockMvc.perform(options("/api/organizations/{org}/alternate-groups/{groupId}", ORG, "grp-1")
                .header("Origin", "https://elsewhere.example.com")
                .header("Access-Control-Request-Method", "PATCH"))
            .andExpect(status().isForbidden());
    }
}

package io.netfield.fieldops.technician;

import static io.netfield.fieldops.TestAddresses.randomMobile;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.netfield.fieldops.TestMessagingConfiguration;
import io.netfield.fieldops.TestcontainersConfiguration;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest
@AutoConfigureMockMvc
@Import({TestcontainersConfiguration.class, TestMessagingConfiguration.class})
@ActiveProfiles("test")
class TechnicianIntegrationTest {

  @Autowired private MockMvc mockMvc;

  @Test
  void shouldNormalizeContactAddressOnCreate() throws Exception {
    var digits = randomMobile().substring(2);

    createTechnician("Budi", "+62 " + digits.substring(0, 3) + "-" + digits.substring(3))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.contactAddress").value("62" + digits))
        .andExpect(jsonPath("$.active").value(true));
  }

  @Test
  void shouldRejectSecondActiveTechnicianWithSameAddress() throws Exception {
    var address = randomMobile();
    createTechnician("Sari", address).andExpect(status().isCreated());

    createTechnician("Sari again", "0" + address.substring(2))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.title").value("Duplicate technician"));
  }

  @Test
  void shouldHideDeactivatedTechnicianFromDefaultList() throws Exception {
    var result = createTechnician("Agus", randomMobile()).andReturn();
    String id = JsonPath.read(result.getResponse().getContentAsString(), "$.id");

    mockMvc
        .perform(post("/api/technicians/" + id + "/deactivate").with(adminJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.active").value(false))
        .andExpect(jsonPath("$.available").value(false));
    mockMvc
        .perform(post("/api/technicians/" + id + "/deactivate").with(adminJwt()))
        .andExpect(status().isConflict());

    mockMvc
        .perform(get("/api/technicians").with(adminJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[*].id", not(hasItem(id))));
    mockMvc
        .perform(get("/api/technicians").param("includeInactive", "true").with(adminJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[*].id", hasItem(id)));
  }

  @Test
  void shouldRejectInvalidContactAddress() throws Exception {
    createTechnician("Dewi", "123").andExpect(status().isBadRequest());
  }

  @Test
  void shouldRequireAuthenticationForApi() throws Exception {
    mockMvc.perform(get("/api/tickets")).andExpect(status().isUnauthorized());
    mockMvc.perform(get("/api/technicians")).andExpect(status().isUnauthorized());
  }

  @Test
  void shouldForbidTechnicianFromManagingTechnicians() throws Exception {
    mockMvc
        .perform(
            post("/api/technicians")
                .with(
                    jwt()
                        .jwt(
                            j ->
                                j.subject(UUID.randomUUID().toString())
                                    .claim("role", "technician"))
                        .authorities(List.of(new SimpleGrantedAuthority("ROLE_TECHNICIAN"))))
                .contentType(MediaType.APPLICATION_JSON)
                .content(technicianJson("Eko", randomMobile())))
        .andExpect(status().isForbidden());
  }

  private ResultActions createTechnician(String name, String contactAddress) throws Exception {
    return mockMvc.perform(
        post("/api/technicians")
            .with(adminJwt())
            .contentType(MediaType.APPLICATION_JSON)
            .content(technicianJson(name, contactAddress)));
  }

  private static String technicianJson(String name, String contactAddress) {
    return """
        {"name": "%s", "contactAddress": "%s"}
        """
        .formatted(name, contactAddress);
  }

  private JwtRequestPostProcessor adminJwt() {
    return jwt()
        .jwt(j -> j.subject(UUID.randomUUID().toString()).claim("role", "admin"))
        .authorities(List.of(new SimpleGrantedAuthority("ROLE_ADMIN")));
  }
}

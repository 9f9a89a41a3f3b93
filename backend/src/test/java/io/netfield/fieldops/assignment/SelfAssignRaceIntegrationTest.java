package io.netfield.fieldops.assignment;

import static io.netfield.fieldops.TestAddresses.randomMobile;
import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;

import io.netfield.fieldops.TestMessagingConfiguration;
import io.netfield.fieldops.TestcontainersConfiguration;
import io.netfield.fieldops.customer.Customer;
import io.netfield.fieldops.customer.CustomerRepository;
import io.netfield.fieldops.technician.TechnicianService;
import io.netfield.fieldops.ticket.TicketCategory;
import io.netfield.fieldops.ticket.TicketService;
import io.netfield.fieldops.ticket.TicketStatus;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.RepeatedTest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.context.annotation.Import;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@Import({TestcontainersConfiguration.class, TestMessagingConfiguration.class})
@ActiveProfiles("test")
class SelfAssignRaceIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private TicketService ticketService;
  @Autowired private TechnicianService technicianService;
  @Autowired private CustomerRepository customerRepository;
  @Autowired private AssignmentRepository assignmentRepository;

  @RepeatedTest(5)
  void concurrent_self_assign_has_exactly_one_winner() throws Exception {
    var customer = customerRepository.save(new Customer("Race Customer", randomMobile()));
    var ticket =
        ticketService.create(
            TicketCategory.INSTALL,
            customer.getId(),
            "Jl. Balapan 7",
            "50 Mbps",
            null,
            UUID.randomUUID(),
            "system");
    var userA = UUID.randomUUID();
    var userB = UUID.randomUUID();
    technicianService.create("Racer A", randomMobile(), userA);
    technicianService.create("Racer B", randomMobile(), userB);

    var barrier = new CyclicBarrier(2);
    var executor = Executors.newFixedThreadPool(2);
    try {
      Future<Integer> first = executor.submit(() -> claim(ticket.getId(), userA, barrier));
      Future<Integer> second = executor.submit(() -> claim(ticket.getId(), userB, barrier));

      var statuses = List.of(first.get(30, TimeUnit.SECONDS), second.get(30, TimeUnit.SECONDS));

      assertThat(statuses).containsOnlyOnce(200);
      assertThat(statuses).containsOnlyOnce(409);
    } finally {
      executor.shutdown();
    }
    assertThat(assignmentRepository.countByTicketId(ticket.getId())).isEqualTo(1);
    assertThat(ticketService.get(ticket.getId()).getStatus()).isEqualTo(TicketStatus.ASSIGNED);
  }

  private int claim(UUID ticketId, UUID userId, CyclicBarrier barrier) throws Exception {
    barrier.await(10, TimeUnit.SECONDS);
    return mockMvc
        .perform(post("/api/tickets/" + ticketId + "/self-assign").with(technicianJwt(userId)))
        .andReturn()
        .getResponse()
        .getStatus();
  }

  private JwtRequestPostProcessor technicianJwt(UUID userId) {
    return jwt()
        .jwt(j -> j.subject(userId.toString()).claim("role", "technician"))
        .authorities(List.of(new SimpleGrantedAuthority("ROLE_TECHNICIAN")));
  }
}

package io.netfield.fieldops.ticket;

import java.time.Clock;
import org.springframework.stereotype.Component;

/** Builds ticket numbers like {@code INS-1718000000000-0042}: prefix, epoch millis, sequence. */
@Component
public class TicketNumberGenerator {

  private final TicketRepository ticketRepository;
  private final Clock clock;

  public TicketNumberGenerator(TicketRepository ticketRepository, Clock clock) {
    this.ticketRepository = ticketRepository;
    this.clock = clock;
  }

  public String next(TicketCategory category) {
    long sequence = ticketRepository.count() + 1;
    return "%s-%d-%04d".formatted(category.numberPrefix(), clock.millis(), sequence);
  }
}

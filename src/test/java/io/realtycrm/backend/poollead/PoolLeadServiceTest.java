package io.realtycrm.backend.poollead;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.realtycrm.backend.audit.AuditEventRecord;
import io.realtycrm.backend.audit.AuditService;
import io.realtycrm.backend.config.PhaseSystemProperties;
import io.realtycrm.backend.contact.Contact;
import io.realtycrm.backend.contact.ContactRepository;
import io.realtycrm.backend.exception.InvalidStateException;
import io.realtycrm.backend.exception.ResourceNotFoundException;
import io.realtycrm.backend.member.AdvisorNameResolver;
import io.realtycrm.backend.member.AppUser;
import io.realtycrm.backend.member.TenantMembership;
import io.realtycrm.backend.member.TenantMembershipRepository;
import io.realtycrm.backend.phase.PhaseConfig;
import io.realtycrm.backend.phase.PhaseConfigRepository;
import io.realtycrm.backend.phase.PhaseProgression;
import io.realtycrm.backend.poollead.WeightedAdvisorSelector.Candidate;
import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PoolLeadServiceTest {

  private static final UUID TENANT_ID = UUID.randomUUID();
  private static final UUID ADVISOR_ID = UUID.randomUUID();
  private static final Instant NOW = Instant.parse("2025-05-20T11:00:00Z");
  private static final YearMonth MAY = YearMonth.of(2025, 5);

  @Mock private PhaseConfigRepository phaseConfigRepository;
  @Mock private TenantMembershipRepository membershipRepository;
  @Mock private ContactRepository contactRepository;
  @Mock private AdvisorNameResolver advisorNameResolver;
  @Mock private WeightedAdvisorSelector selector;
  @Mock private AuditService auditService;
  @Captor private ArgumentCaptor<List<Candidate>> candidatesCaptor;
  @Captor private ArgumentCaptor<AuditEventRecord> auditCaptor;

  private PoolLeadService service;

  @BeforeEach
  void setUp() {
    service =
        new PoolLeadService(
            phaseConfigRepository,
            membershipRepository,
            contactRepository,
            advisorNameResolver,
            selector,
            auditService,
            new PhaseSystemProperties(50, 10, "pool_fases"),
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void selectAdvisorForLead_emptyWhenNotConfigured() {
    when(phaseConfigRepository.findByTenantId(TENANT_ID)).thenReturn(Optional.empty());

    assertThat(service.selectAdvisorForLead(TENANT_ID)).isEmpty();
    verifyNoInteractions(membershipRepository, selector);
  }

  @Test
  void selectAdvisorForLead_emptyWhenInactive() {
    var config = new PhaseConfig(TENANT_ID, NOW);
    config.setActive(false, NOW);
    when(phaseConfigRepository.findByTenantId(TENANT_ID)).thenReturn(Optional.of(config));

    assertThat(service.selectAdvisorForLead(TENANT_ID)).isEmpty();
    verifyNoInteractions(membershipRepository, selector);
  }

  @Test
  void selectAdvisorForLead_weighsCandidatesByPhase() {
    var phaseOne = membershipAtPhase(1);
    var phaseFour = membershipAtPhase(4);
    when(phaseConfigRepository.findByTenantId(TENANT_ID))
        .thenReturn(Optional.of(new PhaseConfig(TENANT_ID, NOW)));
    when(membershipRepository.findLeadCandidates(TENANT_ID))
        .thenReturn(List.of(phaseOne, phaseFour));
    when(selector.select(any())).thenReturn(Optional.of(phaseFour.getUserId()));

    var selected = service.selectAdvisorForLead(TENANT_ID);

    assertThat(selected).contains(phaseFour.getUserId());
    verify(selector).select(candidatesCaptor.capture());
    assertThat(candidatesCaptor.getValue())
        .containsExactly(
            new Candidate(phaseOne.getUserId(), 100), new Candidate(phaseFour.getUserId(), 250));
  }

  @Test
  void selectAdvisorForLead_emptyWithoutEligibleAdvisors() {
    when(phaseConfigRepository.findByTenantId(TENANT_ID))
        .thenReturn(Optional.of(new PhaseConfig(TENANT_ID, NOW)));
    when(membershipRepository.findLeadCandidates(TENANT_ID)).thenReturn(List.of());
    when(selector.select(List.of())).thenReturn(Optional.empty());

    assertThat(service.selectAdvisorForLead(TENANT_ID)).isEmpty();
  }

  @Test
  void markAsPoolLead_usesDefaultSourceWhenBlank() {
    var contact = contact(false);
    when(contactRepository.findByTenantIdAndId(TENANT_ID, contact.getId()))
        .thenReturn(Optional.of(contact));
    when(contactRepository.save(contact)).thenReturn(contact);

    var view = service.markAsPoolLead(TENANT_ID, contact.getId(), " ");

    assertThat(view.leadSource()).isEqualTo("pool_fases");
    assertThat(contact.isPoolLead()).isTrue();
  }

  @Test
  void markAsPoolLead_unknownContactIsNotFound() {
    var contactId = UUID.randomUUID();
    when(contactRepository.findByTenantIdAndId(TENANT_ID, contactId)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.markAsPoolLead(TENANT_ID, contactId, "facebook"))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void assignLead_rejectsContactThatIsNotAPoolLead() {
    var contact = contact(false);
    when(contactRepository.findByTenantIdAndId(TENANT_ID, contact.getId()))
        .thenReturn(Optional.of(contact));

    assertThatThrownBy(() -> service.assignLead(TENANT_ID, contact.getId(), ADVISOR_ID))
        .isInstanceOf(InvalidStateException.class);
    verify(contactRepository, never()).save(any());
  }

  @Test
  void assignLead_rejectsAdvisorOutsideTenant() {
    var contact = contact(true);
    when(contactRepository.findByTenantIdAndId(TENANT_ID, contact.getId()))
        .thenReturn(Optional.of(contact));
    when(membershipRepository.findByTenantIdAndUserId(TENANT_ID, ADVISOR_ID))
        .thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.assignLead(TENANT_ID, contact.getId(), ADVISOR_ID))
        .isInstanceOf(ResourceNotFoundException.class);
    assertThat(contact.getAssignedAdvisorId()).isNull();
  }

  @Test
  void assignLead_overwritesPreviousAssignment() {
    var contact = contact(true);
    var previousAdvisor = UUID.randomUUID();
    contact.assignTo(previousAdvisor, NOW.minusSeconds(3600));
    when(contactRepository.findByTenantIdAndId(TENANT_ID, contact.getId()))
        .thenReturn(Optional.of(contact));
    when(membershipRepository.findByTenantIdAndUserId(TENANT_ID, ADVISOR_ID))
        .thenReturn(Optional.of(new TenantMembership(TENANT_ID, ADVISOR_ID)));
    when(contactRepository.save(contact)).thenReturn(contact);
    when(advisorNameResolver.resolveUsers(List.of(ADVISOR_ID)))
        .thenReturn(Map.of(ADVISOR_ID, new AppUser("Luis", "Mora", "luis@realty.test")));

    var view = service.assignLead(TENANT_ID, contact.getId(), ADVISOR_ID);

    assertThat(view.assignedAdvisorId()).isEqualTo(ADVISOR_ID);
    assertThat(view.leadAssignedAt()).isEqualTo(NOW);
    assertThat(view.advisorFirstName()).isEqualTo("Luis");
    verify(auditService).log(auditCaptor.capture());
    assertThat(auditCaptor.getValue().details())
        .containsEntry("previous_advisor_id", previousAdvisor.toString());
  }

  @Test
  void autoAssign_failsWhenNoAdvisorIsEligible() {
    when(phaseConfigRepository.findByTenantId(TENANT_ID)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.autoAssign(TENANT_ID, UUID.randomUUID()))
        .isInstanceOf(InvalidStateException.class);
    verifyNoInteractions(contactRepository);
  }

  @Test
  void listPoolLeads_filtersByAssignmentSourceAndAdvisor() {
    var assignedToAdvisor = contact(true);
    assignedToAdvisor.assignTo(ADVISOR_ID, NOW);
    var assignedElsewhere = contact(true);
    assignedElsewhere.assignTo(UUID.randomUUID(), NOW);
    var unassigned = contact(true);
    var fromPortal = contact(false);
    fromPortal.markAsPoolLead("portal", NOW);
    when(contactRepository.findPoolLeads(TENANT_ID))
        .thenReturn(List.of(assignedToAdvisor, assignedElsewhere, unassigned, fromPortal));
    when(advisorNameResolver.resolveUsers(any())).thenReturn(Map.of());

    assertThat(service.listPoolLeads(TENANT_ID, null, null, null)).hasSize(4);
    assertThat(service.listPoolLeads(TENANT_ID, false, null, null))
        .extracting(PoolLeadView::id)
        .containsExactly(unassigned.getId(), fromPortal.getId());
    assertThat(service.listPoolLeads(TENANT_ID, true, null, ADVISOR_ID))
        .extracting(PoolLeadView::id)
        .containsExactly(assignedToAdvisor.getId());
    assertThat(service.listPoolLeads(TENANT_ID, null, "portal", null))
        .extracting(PoolLeadView::id)
        .containsExactly(fromPortal.getId());
  }

  private static TenantMembership membershipAtPhase(int phase) {
    var membership = new TenantMembership(TENANT_ID, UUID.randomUUID());
    var state = membership.getPhaseState();
    state.enroll(MAY, NOW);
    for (int i = 1; i < phase; i++) {
      PhaseProgression.applySale(state, MAY);
    }
    return membership;
  }

  private static Contact contact(boolean poolLead) {
    var contact = new Contact(TENANT_ID, "Marta", "Gil", "marta@mail.test", "+34 600 000 000");
    if (poolLead) {
      contact.markAsPoolLead("pool_fases", NOW);
    }
    try {
      var idField = Contact.class.getDeclaredField("id");
      idField.setAccessible(true);
      idField.set(contact, UUID.randomUUID());
    } catch (ReflectiveOperationException e) {
      throw new RuntimeException("Failed to set contact ID", e);
    }
    return contact;
  }
}

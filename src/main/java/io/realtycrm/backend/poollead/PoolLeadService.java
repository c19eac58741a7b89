package io.realtycrm.backend.poollead;

import io.realtycrm.backend.audit.AuditEventBuilder;
import io.realtycrm.backend.audit.AuditService;
import io.realtycrm.backend.config.PhaseSystemProperties;
import io.realtycrm.backend.contact.Contact;
import io.realtycrm.backend.contact.ContactRepository;
import io.realtycrm.backend.exception.InvalidStateException;
import io.realtycrm.backend.exception.ResourceNotFoundException;
import io.realtycrm.backend.member.AdvisorNameResolver;
import io.realtycrm.backend.member.AppUser;
import io.realtycrm.backend.member.TenantMembershipRepository;
import io.realtycrm.backend.phase.PhaseConfig;
import io.realtycrm.backend.phase.PhaseConfigRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Flags contacts as pool leads and hands them to advisors, weighted by phase. */
@Service
public class PoolLeadService {

  private static final Logger log = LoggerFactory.getLogger(PoolLeadService.class);

  private final PhaseConfigRepository phaseConfigRepository;
  private final TenantMembershipRepository membershipRepository;
  private final ContactRepository contactRepository;
  private final AdvisorNameResolver advisorNameResolver;
  private final WeightedAdvisorSelector selector;
  private final AuditService auditService;
  private final PhaseSystemProperties properties;
  private final Clock clock;

  public PoolLeadService(
      PhaseConfigRepository phaseConfigRepository,
      TenantMembershipRepository membershipRepository,
      ContactRepository contactRepository,
      AdvisorNameResolver advisorNameResolver,
      WeightedAdvisorSelector selector,
      AuditService auditService,
      PhaseSystemProperties properties,
      Clock clock) {
    this.phaseConfigRepository = phaseConfigRepository;
    this.membershipRepository = membershipRepository;
    this.contactRepository = contactRepository;
    this.advisorNameResolver = advisorNameResolver;
    this.selector = selector;
    this.auditService = auditService;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Picks the advisor who should receive the next pool lead. Empty when the phase system is not
   * configured or inactive, or when no enrolled non-solitary advisor carries a positive weight.
   */
  @Transactional(readOnly = true)
  public Optional<UUID> selectAdvisorForLead(UUID tenantId) {
    var config = phaseConfigRepository.findByTenantId(tenantId);
    if (config.isEmpty() || !config.get().isActive()) {
      log.debug("Phase system not active for tenant {}, no advisor selected", tenantId);
      return Optional.empty();
    }
    var candidates = candidates(tenantId, config.get());
    var selected = selector.select(candidates);
    log.debug(
        "Selected advisor {} out of {} candidates for tenant {}",
        selected.orElse(null),
        candidates.size(),
        tenantId);
    return selected;
  }

  /**
   * Marks a contact as coming from the advertising pool.
   *
   * @param leadSource source tag; the configured default when null or blank
   * @throws ResourceNotFoundException if the contact does not exist in the tenant
   */
  @Transactional
  public PoolLeadView markAsPoolLead(UUID tenantId, UUID contactId, String leadSource) {
    var contact = requireContact(tenantId, contactId);
    String source =
        leadSource == null || leadSource.isBlank() ? properties.defaultLeadSource() : leadSource;
    contact.markAsPoolLead(source, Instant.now(clock));
    contact = contactRepository.save(contact);
    log.info("Marked contact {} of tenant {} as pool lead ({})", contactId, tenantId, source);
    return toView(contact);
  }

  /**
   * Assigns a pool lead to an advisor, replacing any previous assignment.
   *
   * @throws ResourceNotFoundException if the contact or the advisor's membership is unknown
   * @throws InvalidStateException if the contact is not a pool lead
   */
  @Transactional
  public PoolLeadView assignLead(UUID tenantId, UUID contactId, UUID advisorId) {
    var contact = requireContact(tenantId, contactId);
    if (!contact.isPoolLead()) {
      throw new InvalidStateException(
          "Not a pool lead", "Contact " + contactId + " is not marked as a pool lead");
    }
    if (membershipRepository.findByTenantIdAndUserId(tenantId, advisorId).isEmpty()) {
      throw ResourceNotFoundException.inTenant("Membership", advisorId, tenantId);
    }

    UUID previousAdvisor = contact.getAssignedAdvisorId();
    contact.assignTo(advisorId, Instant.now(clock));
    contact = contactRepository.save(contact);
    log.info("Assigned pool lead {} of tenant {} to advisor {}", contactId, tenantId, advisorId);

    var details = new LinkedHashMap<String, Object>();
    details.put("advisor_id", advisorId.toString());
    if (previousAdvisor != null) {
      details.put("previous_advisor_id", previousAdvisor.toString());
    }
    auditService.log(
        AuditEventBuilder.builder()
            .tenantId(tenantId)
            .eventType("pool_lead.assigned")
            .entityType("contact")
            .entityId(contactId)
            .details(details)
            .build());
    return toView(contact);
  }

  /**
   * Selects an advisor and assigns the lead in one step.
   *
   * @throws InvalidStateException if no advisor is eligible
   */
  @Transactional
  public PoolLeadView autoAssign(UUID tenantId, UUID contactId) {
    UUID advisorId =
        selectAdvisorForLead(tenantId)
            .orElseThrow(
                () ->
                    new InvalidStateException(
                        "No eligible advisor",
                        "No enrolled advisor can receive pool leads in tenant " + tenantId));
    return assignLead(tenantId, contactId, advisorId);
  }

  /**
   * Pool leads of the tenant, most recently assigned first.
   *
   * @param assigned when set, keeps only assigned (true) or unassigned (false) leads
   * @param leadSource when set, keeps only leads with that source
   * @param advisorId when set, keeps only leads assigned to that advisor
   */
  @Transactional(readOnly = true)
  public List<PoolLeadView> listPoolLeads(
      UUID tenantId, Boolean assigned, String leadSource, UUID advisorId) {
    var leads =
        contactRepository.findPoolLeads(tenantId).stream()
            .filter(c -> assigned == null || (c.getAssignedAdvisorId() != null) == assigned)
            .filter(c -> leadSource == null || leadSource.equals(c.getLeadSource()))
            .filter(c -> advisorId == null || advisorId.equals(c.getAssignedAdvisorId()))
            .toList();

    var advisors =
        advisorNameResolver.resolveUsers(
            leads.stream().map(Contact::getAssignedAdvisorId).filter(Objects::nonNull).toList());
    return leads.stream().map(c -> PoolLeadView.from(c, advisorOf(c, advisors))).toList();
  }

  private List<WeightedAdvisorSelector.Candidate> candidates(UUID tenantId, PhaseConfig config) {
    return membershipRepository.findLeadCandidates(tenantId).stream()
        .map(
            m ->
                new WeightedAdvisorSelector.Candidate(
                    m.getUserId(), config.weightFor(m.getPhaseState().getCurrentPhase())))
        .toList();
  }

  private Contact requireContact(UUID tenantId, UUID contactId) {
    return contactRepository
        .findByTenantIdAndId(tenantId, contactId)
        .orElseThrow(() -> ResourceNotFoundException.inTenant("Contact", contactId, tenantId));
  }

  private PoolLeadView toView(Contact contact) {
    UUID advisorId = contact.getAssignedAdvisorId();
    if (advisorId == null) {
      return PoolLeadView.from(contact, null);
    }
    return PoolLeadView.from(
        contact, advisorNameResolver.resolveUsers(List.of(advisorId)).get(advisorId));
  }

  private static AppUser advisorOf(Contact contact, Map<UUID, AppUser> advisors) {
    return contact.getAssignedAdvisorId() != null
        ? advisors.get(contact.getAssignedAdvisorId())
        : null;
  }
}

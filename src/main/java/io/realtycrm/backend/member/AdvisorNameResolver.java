package io.realtycrm.backend.member;

import java.util.Collection;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;

/** Batch-loads user records so list views need one query for names instead of one per row. */
@Service
public class AdvisorNameResolver {

  private final AppUserRepository appUserRepository;

  public AdvisorNameResolver(AppUserRepository appUserRepository) {
    this.appUserRepository = appUserRepository;
  }

  public Map<UUID, AppUser> resolveUsers(Collection<UUID> userIds) {
    if (userIds.isEmpty()) return Map.of();

    return appUserRepository.findAllById(userIds.stream().distinct().toList()).stream()
        .collect(Collectors.toMap(AppUser::getId, Function.identity(), (a, b) -> a));
  }
}

package com.dradmin.registrar.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.dradmin.exception.ResourceNotFoundException;
import com.dradmin.registrar.client.DomainRegistrarClient;
import com.dradmin.registrar.client.DomainRegistrarClientFactory;
import com.dradmin.registrar.client.TldPriceInfo;
import com.dradmin.registrar.dto.PriceDownloadSessionDTO;
import com.dradmin.registrar.dto.RegistrarCostPreviewDTO;
import com.dradmin.registrar.entity.Registrar;
import com.dradmin.registrar.entity.RegistrarTld;
import com.dradmin.registrar.entity.RegistrarTldPriceDownloadSession;
import com.dradmin.registrar.entity.Tld;
import com.dradmin.registrar.repository.RegistrarRepository;
import com.dradmin.registrar.repository.RegistrarTldPriceDownloadSessionRepository;
import com.dradmin.registrar.repository.RegistrarTldRepository;
import com.dradmin.registrar.repository.TldRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * Downloads registrar cost prices for TLDs and stores them on {@link RegistrarTld}.
 */
@Slf4j
@Service
@Transactional
public class RegistrarTldPriceSyncService {

    public static final String TRIGGER_SCHEDULED = "scheduled";
    public static final String TRIGGER_MANUAL = "manual";
    private static final String DEFAULT_CURRENCY = "USD";

    @Autowired
    private RegistrarRepository registrarRepository;

    @Autowired
    private TldRepository tldRepository;

    @Autowired
    private RegistrarTldRepository registrarTldRepository;

    @Autowired
    private RegistrarTldPriceDownloadSessionRepository sessionRepository;

    @Autowired
    private DomainRegistrarClientFactory clientFactory;

    @Scheduled(cron = "${dradmin.domains.price-sync-cron:0 30 2 * * *}")
    public void scheduledSync() {
        int synced = syncRegistrarsMissingToday(TRIGGER_SCHEDULED);
        log.info("Scheduled registrar price sync finished, {} registrars synced", synced);
    }

    /**
     * Live costs for one extension from every active registrar. Registrars that fail are skipped.
     */
    @Transactional(readOnly = true)
    public List<RegistrarCostPreviewDTO> previewRegistrarCostsByExtension(String extension) {
        String normalized = Tld.normalize(extension);
        if (normalized == null || normalized.isEmpty()) {
            return List.of();
        }
        List<RegistrarCostPreviewDTO> rows = new ArrayList<>();
        for (Registrar registrar : registrarRepository.findByActiveTrueOrderByNameAsc()) {
            try {
                Optional<TldPriceInfo> info = fetchPrice(registrar, normalized);
                info.ifPresent(price -> rows.add(RegistrarCostPreviewDTO.builder()
                        .registrarId(registrar.getId())
                        .registrarName(registrar.getName())
                        .extension(normalized)
                        .registrationCost(price.getRegistrationPrice())
                        .renewalCost(price.getRenewalPrice())
                        .transferCost(price.getTransferPrice())
                        .currency(currencyOf(price))
                        .build()));
            } catch (RuntimeException e) {
                log.warn("Failed previewing prices for registrar {} and .{}: {}", registrar.getId(), normalized, e.getMessage());
            }
        }
        rows.sort(Comparator.comparing(RegistrarCostPreviewDTO::getRegistrarName, String.CASE_INSENSITIVE_ORDER));
        return rows;
    }

    /**
     * Updates the cost of one TLD at every active registrar that prices it. Missing registrar links are created.
     *
     * @return number of registrars whose price was stored
     */
    public int syncRegistrarsForTld(Long tldId, String triggerSource) {
        Tld tld = tldRepository.findById(tldId).orElseThrow(() -> new ResourceNotFoundException("TLD", tldId));
        if (!tld.isActive()) {
            return 0;
        }
        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);
        int synced = 0;
        for (Registrar registrar : registrarRepository.findByActiveTrueOrderByNameAsc()) {
            try {
                Optional<TldPriceInfo> info = fetchPrice(registrar, tld.getExtension());
                if (info.isEmpty()) {
                    continue;
                }
                RegistrarTld link = registrarTldRepository.findByRegistrarIdAndTldId(registrar.getId(), tld.getId())
                        .orElseGet(() -> RegistrarTld.builder()
                                .registrar(registrar)
                                .tld(tld)
                                .active(true)
                                .minRegistrationYears(1)
                                .maxRegistrationYears(10)
                                .notes("Auto-created from registrar price sync")
                                .build());
                applyPrice(link, info.get(), now);
                registrarTldRepository.save(link);
                synced++;
            } catch (RuntimeException e) {
                log.error("Error syncing registrar {} for TLD {} ({})", registrar.getId(), tldId, triggerSource, e);
            }
        }
        log.info("Synced .{} prices from {} registrars ({})", tld.getExtension(), synced, triggerSource);
        return synced;
    }

    /**
     * Downloads prices for every active TLD the registrar is linked to and records a download session.
     */
    public PriceDownloadSessionDTO syncRegistrar(Long registrarId, String triggerSource) {
        Registrar registrar = registrarRepository.findById(registrarId)
                .orElseThrow(() -> new ResourceNotFoundException("Registrar", registrarId));
        return PriceDownloadSessionDTO.fromEntity(syncRegistrar(registrar, triggerSource));
    }

    /**
     * Syncs each active registrar without a successful session since the start of the current UTC day.
     *
     * @return number of registrars synced
     */
    public int syncRegistrarsMissingToday(String triggerSource) {
        LocalDateTime startOfDay = LocalDate.now(ZoneOffset.UTC).atStartOfDay();
        int synced = 0;
        for (Registrar registrar : registrarRepository.findByActiveTrueOrderByNameAsc()) {
            if (sessionRepository.existsByRegistrarIdAndSuccessTrueAndStartedAtGreaterThanEqual(registrar.getId(), startOfDay)) {
                continue;
            }
            syncRegistrar(registrar, triggerSource);
            synced++;
        }
        return synced;
    }

    @Transactional(readOnly = true)
    public List<PriceDownloadSessionDTO> getDownloadSessions(Long registrarId) {
        return sessionRepository.findTop50ByRegistrarIdOrderByStartedAtDesc(registrarId).stream()
                .map(PriceDownloadSessionDTO::fromEntity)
                .collect(Collectors.toList());
    }

    private RegistrarTldPriceDownloadSession syncRegistrar(Registrar registrar, String triggerSource) {
        RegistrarTldPriceDownloadSession session = sessionRepository.save(RegistrarTldPriceDownloadSession.builder()
                .registrar(registrar)
                .triggerSource(triggerSource)
                .startedAt(LocalDateTime.now(ZoneOffset.UTC))
                .success(false)
                .build());
        try {
            List<RegistrarTld> links = registrarTldRepository.findActiveForSync(registrar.getId());
            if (links.isEmpty()) {
                session.setMessage("No active registrar/TLD combinations found");
            } else {
                List<String> extensions = links.stream().map(l -> l.getTld().getExtension()).distinct().collect(Collectors.toList());
                DomainRegistrarClient client = clientFactory.createRegistrar(registrar.getCode());
                Map<String, TldPriceInfo> prices = client.getSupportedTlds(extensions).stream()
                        .filter(p -> p.getExtension() != null)
                        .collect(Collectors.toMap(p -> Tld.normalize(p.getExtension()), Function.identity(), (a, b) -> a));
                LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);
                int changes = 0;
                for (RegistrarTld link : links) {
                    TldPriceInfo price = prices.get(link.getTld().getExtension());
                    if (price == null || !price.hasAnyPrice()) {
                        continue;
                    }
                    if (applyPrice(link, price, now)) {
                        changes++;
                    }
                    registrarTldRepository.save(link);
                }
                session.setTldsProcessed(links.size());
                session.setPriceChanges(changes);
                session.setMessage("Processed " + links.size() + " registrar/TLD combinations");
            }
            session.setSuccess(true);
        } catch (RuntimeException e) {
            log.error("Error syncing registrar prices for registrar {}", registrar.getId(), e);
            session.setSuccess(false);
            session.setErrorMessage(e.getMessage());
        }
        session.setCompletedAt(LocalDateTime.now(ZoneOffset.UTC));
        return sessionRepository.save(session);
    }

    private Optional<TldPriceInfo> fetchPrice(Registrar registrar, String extension) {
        DomainRegistrarClient client = clientFactory.createRegistrar(registrar.getCode());
        return client.getSupportedTlds(List.of(extension)).stream()
                .filter(p -> extension.equals(Tld.normalize(p.getExtension())))
                .filter(TldPriceInfo::hasAnyPrice)
                .findFirst();
    }

    /**
     * @return true when any stored cost or the currency changed
     */
    private boolean applyPrice(RegistrarTld link, TldPriceInfo price, LocalDateTime now) {
        BigDecimal registration = orZero(price.getRegistrationPrice());
        BigDecimal renewal = orZero(price.getRenewalPrice());
        BigDecimal transfer = orZero(price.getTransferPrice());
        String currency = currencyOf(price);
        boolean changed = !sameAmount(link.getRegistrationCost(), registration)
                || !sameAmount(link.getRenewalCost(), renewal)
                || !sameAmount(link.getTransferCost(), transfer)
                || !currency.equalsIgnoreCase(Objects.toString(link.getCurrency(), ""));
        link.setRegistrationCost(registration);
        link.setRenewalCost(renewal);
        link.setTransferCost(transfer);
        link.setCurrency(currency);
        link.setLastSyncedAt(now);
        return changed;
    }

    private static boolean sameAmount(BigDecimal current, BigDecimal target) {
        return current != null && current.compareTo(target) == 0;
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    private static String currencyOf(TldPriceInfo price) {
        return price.getCurrency() == null || price.getCurrency().isBlank()
                ? DEFAULT_CURRENCY : price.getCurrency().toUpperCase();
    }
}

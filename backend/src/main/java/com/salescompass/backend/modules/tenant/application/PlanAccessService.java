package com.salescompass.backend.modules.tenant.application;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.salescompass.backend.global.error.ProblemException;
import com.salescompass.backend.modules.accesscontrol.application.PlanModuleGate;
import com.salescompass.backend.modules.tenant.domain.Plan;
import com.salescompass.backend.modules.tenant.domain.PlanFeatureAccess;
import com.salescompass.backend.modules.tenant.domain.PlanModuleAccess;
import com.salescompass.backend.modules.tenant.infrastructure.persistence.PlanFeatureAccessRepository;
import com.salescompass.backend.modules.tenant.infrastructure.persistence.PlanModuleAccessRepository;
import com.salescompass.backend.modules.tenant.infrastructure.persistence.PlanRepository;

/**
 * Plan-based module and feature access.
 * The plan's JSON {@code features_config} is the source of truth; the module/feature rows are
 * a synchronised projection used for point lookups, with the JSON as fallback when a row is missing.
 */
@Service
@Transactional(readOnly = true)
public class PlanAccessService implements PlanModuleGate {

    private static final Logger log = LoggerFactory.getLogger(PlanAccessService.class);

    private final PlanRepository planRepository;
    private final PlanModuleAccessRepository planModuleAccessRepository;
    private final PlanFeatureAccessRepository planFeatureAccessRepository;

    public PlanAccessService(
            PlanRepository planRepository,
            PlanModuleAccessRepository planModuleAccessRepository,
            PlanFeatureAccessRepository planFeatureAccessRepository
    ) {
        this.planRepository = planRepository;
        this.planModuleAccessRepository = planModuleAccessRepository;
        this.planFeatureAccessRepository = planFeatureAccessRepository;
    }

    @Transactional
    public PlanSyncResult syncPlanAccess(UUID planId) {
        Plan plan = planRepository.findById(planId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "plan.not_found", "Plan not found: " + planId));
        return syncPlanAccess(plan);
    }

    @Transactional
    public PlanSyncResult syncPlanAccess(Plan plan) {
        Map<String, Object> config = plan.getFeaturesConfig();
        if (config == null || config.isEmpty()) {
            return new PlanSyncResult(plan.getId(), 0, 0);
        }

        int modules = 0;
        int features = 0;
        for (Map.Entry<String, Object> moduleEntry : config.entrySet()) {
            String moduleName = moduleEntry.getKey();
            Map<String, Object> moduleData = asMap(moduleEntry.getValue());

            PlanModuleAccess moduleAccess = planModuleAccessRepository.findByPlanIdAndModuleName(plan.getId(), moduleName)
                    .orElseGet(() -> {
                        PlanModuleAccess created = new PlanModuleAccess();
                        created.setPlan(plan);
                        created.setModuleName(moduleName);
                        return created;
                    });
            Object displayName = moduleData.get("display_name");
            moduleAccess.setModuleDisplayName(displayName != null ? displayName.toString() : titleCase(moduleName));
            moduleAccess.setAvailable(isTrue(moduleData.get("enabled")));
            planModuleAccessRepository.save(moduleAccess);
            modules++;

            for (Map.Entry<String, Object> featureEntry : asMap(moduleData.get("features")).entrySet()) {
                String featureKey = featureEntry.getKey();
                PlanFeatureAccess featureAccess = planFeatureAccessRepository.findByPlanIdAndFeatureKey(plan.getId(), featureKey)
                        .orElseGet(() -> {
                            PlanFeatureAccess created = new PlanFeatureAccess();
                            created.setPlan(plan);
                            created.setFeatureKey(featureKey);
                            return created;
                        });
                featureAccess.setFeatureName(titleCase(featureKey));
                featureAccess.setFeatureCategory(moduleName);
                featureAccess.setAvailable(isTrue(featureEntry.getValue()));
                planFeatureAccessRepository.save(featureAccess);
                features++;
            }
        }

        log.info("Synchronized access configuration for plan {}: {} modules, {} features", plan.getName(), modules, features);
        return new PlanSyncResult(plan.getId(), modules, features);
    }

    public boolean getModuleAccess(Plan plan, String moduleName) {
        if (plan == null) {
            return false;
        }
        return planModuleAccessRepository.findByPlanIdAndModuleName(plan.getId(), moduleName)
                .map(PlanModuleAccess::isAvailable)
                .orElseGet(() -> isTrue(moduleConfig(plan, moduleName).get("enabled")));
    }

    public boolean getFeatureAccess(Plan plan, String moduleName, String featureKey) {
        if (plan == null || !getModuleAccess(plan, moduleName)) {
            return false;
        }
        return planFeatureAccessRepository.findByPlanIdAndFeatureKey(plan.getId(), featureKey)
                .map(PlanFeatureAccess::isAvailable)
                .orElseGet(() -> isTrue(asMap(moduleConfig(plan, moduleName).get("features")).get(featureKey)));
    }

    @Override
    public boolean isModuleEnabled(Plan plan, String moduleName) {
        return getModuleAccess(plan, moduleName);
    }

    private Map<String, Object> moduleConfig(Plan plan, String moduleName) {
        Map<String, Object> config = plan.getFeaturesConfig();
        return config == null ? Map.of() : asMap(config.get(moduleName));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    private static boolean isTrue(Object value) {
        return Boolean.TRUE.equals(value);
    }

    static String titleCase(String key) {
        return Arrays.stream(key.replace('_', ' ').split(" "))
                .filter(word -> !word.isEmpty())
                .map(word -> word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1).toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(" "));
    }

    public record PlanSyncResult(UUID planId, int modules, int features) {
    }
}

package com.dexarena.tournament.strategy;

import com.dexarena.tournament.model.CompetitorId;
import com.dexarena.tournament.model.InvalidTournamentInputException;
import io.github.classgraph.ClassGraph;
import io.github.classgraph.ClassInfo;
import io.github.classgraph.ScanResult;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.ToIntFunction;

/**
 * Discovers {@link MatchDecider} implementations annotated with {@link DeciderDescription}
 * and caches their metadata by key.
 */
@Service
public class DeciderDiscoveryService {

    private static final Logger log = LoggerFactory.getLogger(DeciderDiscoveryService.class);

    private final String[] packages;
    private final Map<String, DiscoveredDecider> decidersByKey = new ConcurrentHashMap<>();
    private volatile List<DiscoveredDecider> cachedDeciders = List.of();

    public DeciderDiscoveryService() {
        this(MatchDecider.class.getPackageName());
    }

    /**
     * @param packages packages to scan, including their subpackages
     */
    public DeciderDiscoveryService(String... packages) {
        this.packages = packages.clone();
    }

    @PostConstruct
    public void initialize() {
        scanClasspath();
    }

    public synchronized void scanClasspath() {
        List<DiscoveredDecider> found = new ArrayList<>();

        try (ScanResult result = new ClassGraph()
                .enableClassInfo()
                .enableAnnotationInfo()
                .acceptPackages(packages)
                .scan()) {

            for (ClassInfo classInfo : result.getClassesImplementing(MatchDecider.class.getName())) {
                if (classInfo.isInterface() || classInfo.isAbstract()
                        || !classInfo.hasAnnotation(DeciderDescription.class.getName())) {
                    continue;
                }
                String className = classInfo.getName();
                try {
                    DiscoveredDecider decider = analyzeDeciderClass(Class.forName(className));
                    if (decider.isInstantiable()) {
                        found.add(decider);
                    }
                } catch (ClassNotFoundException | LinkageError e) {
                    log.warn("Could not analyze MatchDecider class {}: {}", className, e.getMessage());
                }
            }
        }

        decidersByKey.clear();
        for (DiscoveredDecider decider : found) {
            DiscoveredDecider previous = decidersByKey.putIfAbsent(decider.key(), decider);
            if (previous != null) {
                log.warn("Decider key '{}' used by both {} and {}; keeping the first",
                    decider.key(), previous.className(), decider.className());
            }
        }
        List<DiscoveredDecider> sorted = new ArrayList<>(decidersByKey.values());
        sorted.sort(Comparator.comparing(DiscoveredDecider::key));
        cachedDeciders = List.copyOf(sorted);
        log.debug("Discovered {} match deciders", cachedDeciders.size());
    }

    private DiscoveredDecider analyzeDeciderClass(Class<?> deciderClass) {
        DeciderDescription description = deciderClass.getAnnotation(DeciderDescription.class);
        boolean hasZeroArg = false;
        boolean hasStatConstructor = false;
        for (Constructor<?> ctor : deciderClass.getConstructors()) {
            Class<?>[] params = ctor.getParameterTypes();
            if (params.length == 0) {
                hasZeroArg = true;
            } else if (params.length == 1 && params[0] == ToIntFunction.class) {
                hasStatConstructor = true;
            }
        }
        return new DiscoveredDecider(
            description.key(), deciderClass.getName(), description.value(), hasZeroArg, hasStatConstructor);
    }

    /**
     * Returns all discovered deciders, sorted by key.
     */
    public List<DiscoveredDecider> getDiscoveredDeciders() {
        return cachedDeciders;
    }

    public Optional<DiscoveredDecider> findByKey(String key) {
        return Optional.ofNullable(decidersByKey.get(key));
    }

    /**
     * Instantiates the decider registered under {@code key}. The stat constructor is
     * preferred when the class has one.
     *
     * @throws InvalidTournamentInputException if no decider has that key
     */
    public MatchDecider createDecider(String key, ToIntFunction<CompetitorId> statLookup)
            throws ReflectiveOperationException {
        DiscoveredDecider discovered = findByKey(key)
            .orElseThrow(() -> new InvalidTournamentInputException("Unknown decider: " + key));
        Class<?> deciderClass = Class.forName(discovered.className());
        if (discovered.hasStatConstructor()) {
            Constructor<?> ctor = deciderClass.getConstructor(ToIntFunction.class);
            return (MatchDecider) ctor.newInstance(statLookup);
        }
        if (discovered.hasZeroArgConstructor()) {
            return (MatchDecider) deciderClass.getConstructor().newInstance();
        }
        throw new IllegalStateException("No suitable constructor found for " + discovered.className());
    }
}

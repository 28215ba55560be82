package tw.gc.auto.lifecycle.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class FamilyBootstrap {

    private final ModelFamilyService familyService;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        familyService.registerConfiguredFamilies();
        log.info("🧬 Model families ready: {}", familyService.listFamilyIds());
    }
}

package com.elssolution.greenguard.web;

import com.elssolution.greenguard.domain.FacilityRules;
import com.elssolution.greenguard.service.FacilityRulesService;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/facilities")
public class FacilityController {

    private final FacilityRulesService facilities;

    public FacilityController(FacilityRulesService facilities) {
        this.facilities = facilities;
    }

    @GetMapping
    public List<FacilityRules> list() {
        return facilities.list();
    }

    @GetMapping("/{id}")
    public FacilityRules get(@PathVariable("id") String id) {
        return facilities.get(id);
    }

    @PutMapping("/{id}/rules")
    public FacilityRules updateRules(@PathVariable("id") String id, @RequestBody RulesUpdate body) {
        if (body == null || body.maxLoadKwh() == null || body.baselineCarbonIntensity() == null) {
            throw new IllegalArgumentException("maxLoadKwh and baselineCarbonIntensity are required");
        }
        return facilities.updateRules(id, body.maxLoadKwh(), body.baselineCarbonIntensity());
    }

    public record RulesUpdate(Double maxLoadKwh, Double baselineCarbonIntensity) {}
}

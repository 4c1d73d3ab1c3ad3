package com.mealshift.orderservice.service;

import com.mealshift.orderservice.dto.PersonStandingResponse;
import com.mealshift.orderservice.dto.PersonSyncRequest;
import com.mealshift.orderservice.model.Person;
import com.mealshift.orderservice.repository.PersonRepository;
import com.mealshift.orderservice.time.ClockSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Keeps the local person projection in step with the account service.
 * Strike counts are never touched here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PersonDirectoryService {

    private final PersonRepository personRepository;
    private final StrikeLedger strikeLedger;
    private final ClockSource clock;

    @Transactional
    public PersonStandingResponse upsert(UUID personId, PersonSyncRequest request) {
        Person person = personRepository.findById(personId).orElseGet(() -> {
            Person created = new Person();
            created.setId(personId);
            log.info("Person registered: personId={}", personId);
            return created;
        });
        if (request.getDisplayName() != null) {
            person.setDisplayName(request.getDisplayName());
        }
        if (request.getActive() != null) {
            if (person.isActive() != request.getActive()) {
                log.info("Person active flag changed: personId={}, active={}", personId, request.getActive());
            }
            person.setActive(request.getActive());
        }
        person.setSyncedAt(clock.now());
        personRepository.saveAndFlush(person);
        return strikeLedger.standing(personId);
    }
}

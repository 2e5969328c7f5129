package com.contenttracker.application.port.out;

import com.contenttracker.domain.model.Actor;
import com.contenttracker.domain.model.ActorId;

public interface ActorRepository extends AggregateRepository<ActorId, Actor> {
}

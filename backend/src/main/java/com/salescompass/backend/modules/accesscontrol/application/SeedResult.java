package com.salescompass.backend.modules.accesscontrol.application;

public record SeedResult(int apps, int definitionsCreated, int grantsCreated, int grantsUpdated) {
}

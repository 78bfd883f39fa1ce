package com.dragonfly.jobs.service;

import com.dragonfly.jobs.model.JobEnvelope;

public record FollowUpJob(String queueName, JobEnvelope envelope) {}

package com.scholary.spatialaudio.job;

/** Thrown when a job, or an artifact within a job, does not exist. */
public class JobNotFoundException extends RuntimeException {

  public JobNotFoundException(String message) {
    super(message);
  }
}

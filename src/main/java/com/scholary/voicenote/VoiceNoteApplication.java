package com.scholary.voicenote;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class VoiceNoteApplication {

  public static void main(String[] args) {
    SpringApplication.run(VoiceNoteApplication.class, args);
  }
}

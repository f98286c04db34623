package com.programmersdiary.crondaemon.chat;

import java.util.List;

/**
 * Answer to show the user plus side-effect notices such as jobs created from the answer.
 */
public record ChatReply(String text, List<String> notices) {
}

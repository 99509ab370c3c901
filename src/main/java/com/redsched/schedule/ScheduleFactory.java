package com.redsched.schedule;

import java.util.Map;

/**
 * Rebuilds a {@link Schedule} from its stored arguments. Declare one as a bean to make an
 * additional schedule kind decodable.
 */
public interface ScheduleFactory {

    String type();

    Schedule create(Map<String, Object> arguments);
}

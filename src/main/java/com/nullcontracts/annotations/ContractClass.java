package com.nullcontracts.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Placed on an interface or abstract class to name the companion type that
 * carries the contract statements for its bodiless members.
 * The companion must carry a {@link ContractClassFor} pointing back.
 */
@Retention(RetentionPolicy.CLASS)
@Target(ElementType.TYPE)
public @interface ContractClass {
    /**
     * The companion type.
     * @return The class holding the contracts
     */
    Class<?> value();
}

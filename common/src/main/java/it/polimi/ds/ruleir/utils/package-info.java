@NullMarked
package it.polimi.ds.ruleir.utils;

import org.jspecify.annotations.NullMarked;

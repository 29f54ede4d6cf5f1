package com.vybe.backend.modules.auth.presentation.dto;

final class PhoneFormat {

    /** Leading plus, country code, 10 to 15 digits in total. */
    static final String E164 = "^\\+[1-9]\\d{9,14}$";

    private PhoneFormat() {
    }
}

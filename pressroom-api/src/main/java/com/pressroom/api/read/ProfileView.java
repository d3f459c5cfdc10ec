package com.pressroom.api.read;

import com.pressroom.core.domain.Account;
import com.pressroom.core.domain.Profile;

public record ProfileView(Profile profile, Account account) {}
